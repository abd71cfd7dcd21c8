package com.aiinpocket.combat.controller;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.domain.RewardBundle;
import com.aiinpocket.combat.model.dto.SessionSummary;
import com.aiinpocket.combat.model.dto.StartCombatRequest;
import com.aiinpocket.combat.model.dto.TapRequest;
import com.aiinpocket.combat.model.dto.TurnResult;
import com.aiinpocket.combat.service.combat.CombatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 戰鬥 REST API。
 * 用戶 ID 由上游閘道驗證後放在 {@code X-User-Id} 標頭；存取他人的場次一律回 404。
 */
@RestController
@RequestMapping("/api/combat")
@RequiredArgsConstructor
public class CombatController {

    static final String USER_HEADER = "X-User-Id";

    private final CombatService combatService;

    /** 開戰（未指定等級時以玩家等級開戰） */
    @PostMapping("/start")
    public ResponseEntity<SessionSummary> start(@RequestHeader(USER_HEADER) Long userId,
                                                @Valid @RequestBody StartCombatRequest request) {
        SessionSummary summary = request.combatLevel() == null
                ? combatService.startCombat(userId, request.locationId())
                : combatService.startCombat(userId, request.locationId(), request.combatLevel());
        return ResponseEntity.ok(summary);
    }

    /** 取得目前未結束的場次（斷線重連用） */
    @GetMapping("/active")
    public ResponseEntity<SessionSummary> active(@RequestHeader(USER_HEADER) Long userId) {
        return combatService.getActiveSession(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSummary> get(@RequestHeader(USER_HEADER) Long userId,
                                              @PathVariable String sessionId) {
        requireOwner(userId, sessionId);
        return ResponseEntity.ok(combatService.getSession(sessionId));
    }

    @PostMapping("/{sessionId}/attack")
    public ResponseEntity<TurnResult> attack(@RequestHeader(USER_HEADER) Long userId,
                                             @PathVariable String sessionId,
                                             @Valid @RequestBody TapRequest request) {
        requireOwner(userId, sessionId);
        return ResponseEntity.ok(combatService.submitAttack(sessionId, request.tapDegrees()));
    }

    @PostMapping("/{sessionId}/defend")
    public ResponseEntity<TurnResult> defend(@RequestHeader(USER_HEADER) Long userId,
                                             @PathVariable String sessionId,
                                             @Valid @RequestBody TapRequest request) {
        requireOwner(userId, sessionId);
        return ResponseEntity.ok(combatService.submitDefend(sessionId, request.tapDegrees()));
    }

    /** 領取獎勵（可重複呼叫，回傳相同結果） */
    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<RewardBundle> complete(@RequestHeader(USER_HEADER) Long userId,
                                                 @PathVariable String sessionId) {
        requireOwner(userId, sessionId);
        return ResponseEntity.ok(combatService.completeCombat(sessionId));
    }

    @PostMapping("/{sessionId}/abandon")
    public ResponseEntity<Void> abandon(@RequestHeader(USER_HEADER) Long userId,
                                        @PathVariable String sessionId) {
        requireOwner(userId, sessionId);
        combatService.abandonCombat(sessionId);
        return ResponseEntity.noContent().build();
    }

    private void requireOwner(Long userId, String sessionId) {
        boolean owned = combatService.findOwner(sessionId)
                .map(userId::equals)
                .orElse(false);
        if (!owned) {
            throw new NotFoundException("戰鬥場次", sessionId);
        }
    }
}
