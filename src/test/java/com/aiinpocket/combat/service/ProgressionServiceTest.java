package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.dto.LevelUpResult;
import com.aiinpocket.combat.model.entity.PlayerProfile;
import com.aiinpocket.combat.repository.PlayerProfileRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProgressionServiceTest {

    @Mock
    private PlayerProfileRepository profileRepo;

    @InjectMocks
    private ProgressionService service;

    @Test
    void levelCurveIsQuadratic() {
        assertEquals(200, ProgressionService.expForLevel(2));
        assertEquals(1, ProgressionService.levelForExp(199));
        assertEquals(2, ProgressionService.levelForExp(200));
        assertEquals(3, ProgressionService.levelForExp(450));
    }

    @Test
    void experienceCanLevelUpMoreThanOnce() {
        PlayerProfile profile = PlayerProfile.builder().id(1L).level(1).experience(150L).build();
        when(profileRepo.findById(1L)).thenReturn(Optional.of(profile));

        LevelUpResult result = service.addExperience(1L, 300);

        assertTrue(result.leveledUp());
        assertEquals(1, result.oldLevel());
        assertEquals(3, result.newLevel());
        assertEquals(450, result.currentExp());
        assertEquals(350, result.expToNextLevel());
        assertEquals(3, profile.getLevel());
        verify(profileRepo).save(profile);
    }

    @Test
    void smallGainKeepsLevel() {
        PlayerProfile profile = PlayerProfile.builder().id(1L).level(2).experience(200L).build();
        when(profileRepo.findById(1L)).thenReturn(Optional.of(profile));

        LevelUpResult result = service.addExperience(1L, 10);

        assertFalse(result.leveledUp());
        assertEquals(2, result.newLevel());
    }

    @Test
    void unknownPlayerIsNotFound() {
        when(profileRepo.findById(9L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.currentLevel(9L));
    }
}
