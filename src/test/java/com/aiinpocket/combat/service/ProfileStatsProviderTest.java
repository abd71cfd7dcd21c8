package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.domain.PlayerStats;
import com.aiinpocket.combat.model.domain.WeaponBands;
import com.aiinpocket.combat.model.entity.PlayerProfile;
import com.aiinpocket.combat.model.entity.WeaponBandConfig;
import com.aiinpocket.combat.repository.PlayerProfileRepository;
import com.aiinpocket.combat.repository.WeaponBandConfigRepository;
import com.aiinpocket.combat.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileStatsProviderTest {

    @Mock
    private PlayerProfileRepository profileRepo;
    @Mock
    private WeaponBandConfigRepository bandConfigRepo;

    private ProfileStatsProvider provider;

    @BeforeEach
    void setUp() {
        provider = new ProfileStatsProvider(profileRepo, bandConfigRepo, TestFixtures.properties());
    }

    @Test
    void unarmedPlayerUsesDefaultDial() {
        when(profileRepo.findById(1L)).thenReturn(Optional.of(
                PlayerProfile.builder().id(1L).atk(12).def(4).hp(80).accuracy(0.25).build()));

        PlayerStats stats = provider.getEquippedStats(1L);

        assertEquals(new PlayerStats(12, 4, 80, 0.25, WeaponBands.DEFAULT), stats);
        verifyNoInteractions(bandConfigRepo);
    }

    @Test
    void equippedWeaponBringsItsDial() {
        when(profileRepo.findById(1L)).thenReturn(Optional.of(
                PlayerProfile.builder().id(1L).equippedWeaponTypeId("katana").build()));
        when(bandConfigRepo.findById("katana")).thenReturn(Optional.of(WeaponBandConfig.builder()
                .itemTypeId("katana").injure(2.0).miss(30.0).graze(40.0).normal(200.0).crit(88.0).build()));

        assertEquals(new WeaponBands(2, 30, 40, 200, 88), provider.getEquippedStats(1L).weapon());
    }

    @Test
    void weaponWithoutDialFallsBackToDefault() {
        when(profileRepo.findById(1L)).thenReturn(Optional.of(
                PlayerProfile.builder().id(1L).equippedWeaponTypeId("stick").build()));
        when(bandConfigRepo.findById("stick")).thenReturn(Optional.empty());

        assertEquals(WeaponBands.DEFAULT, provider.getEquippedStats(1L).weapon());
    }

    @Test
    void unknownPlayerIsNotFound() {
        when(profileRepo.findById(9L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> provider.getEquippedStats(9L));
    }
}
