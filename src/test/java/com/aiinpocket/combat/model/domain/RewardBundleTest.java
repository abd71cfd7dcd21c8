package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.Rarity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RewardBundleTest {

    private static final MaterialReward COFFEE = new MaterialReward("coffee", "Coffee", "normal", 2);

    @Test
    void defeatCarriesNothing() {
        RewardBundle defeat = RewardBundle.defeat();

        assertEquals(CombatStatus.DEFEAT, defeat.outcome());
        assertEquals(0, defeat.gold());
        assertTrue(defeat.materials().isEmpty());
        assertTrue(defeat.items().isEmpty());
    }

    @Test
    void defeatWithLootIsRejected() {
        assertThrows(ValidationException.class, () -> new RewardBundle(CombatStatus.DEFEAT, 10,
                List.of(), List.of(), 0, null, null));
        assertThrows(ValidationException.class, () -> new RewardBundle(CombatStatus.DEFEAT, 0,
                List.of(COFFEE), List.of(), 0, null, null));
    }

    @Test
    void ongoingIsNotAnOutcome() {
        assertThrows(ValidationException.class, () -> new RewardBundle(CombatStatus.ONGOING, 0,
                List.of(), List.of(), 0, null, null));
    }

    @Test
    void emptyMaterialStackIsRejected() {
        assertThrows(ValidationException.class, () -> RewardBundle.victory(10, 10,
                new LootDrop(List.of(new MaterialReward("coffee", "Coffee", "normal", 0)), List.of())));
    }

    @Test
    void victoryKeepsLootAndCopiesLists() {
        ItemReward sword = new ItemReward("sword", "Sword", Rarity.RARE, "normal", null);
        RewardBundle bundle = RewardBundle.victory(75, 130, new LootDrop(List.of(COFFEE), List.of(sword)));

        assertEquals(List.of(COFFEE), bundle.materials());
        assertThrows(UnsupportedOperationException.class, () -> bundle.items().add(sword));

        RewardBundle granted = bundle.withItems(List.of(sword.withCreatedItemId(9L)));
        assertEquals(9L, granted.items().get(0).createdItemId());
        assertNull(bundle.items().get(0).createdItemId());
    }
}
