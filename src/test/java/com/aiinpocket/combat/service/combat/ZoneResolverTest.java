package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.model.domain.WeaponBands;
import com.aiinpocket.combat.model.enums.HitZone;
import com.aiinpocket.combat.support.ScriptedRandom;
import com.aiinpocket.combat.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ZoneResolverTest {

    private final ZoneResolver resolver = new ZoneResolver(TestFixtures.properties());

    @Test
    void zonesFollowTheFixedOrderFromZero() {
        WeaponBands bands = WeaponBands.DEFAULT;

        assertEquals(HitZone.INJURE, ZoneResolver.zoneAt(0, bands));
        assertEquals(HitZone.INJURE, ZoneResolver.zoneAt(4.999, bands));
        assertEquals(HitZone.MISS, ZoneResolver.zoneAt(5, bands));
        assertEquals(HitZone.MISS, ZoneResolver.zoneAt(49.9, bands));
        assertEquals(HitZone.GRAZE, ZoneResolver.zoneAt(50, bands));
        assertEquals(HitZone.NORMAL, ZoneResolver.zoneAt(110, bands));
        assertEquals(HitZone.NORMAL, ZoneResolver.zoneAt(300, bands));
        assertEquals(HitZone.CRIT, ZoneResolver.zoneAt(310, bands));
        assertEquals(HitZone.CRIT, ZoneResolver.zoneAt(359.99, bands));
    }

    @Test
    void arcBeyondTheBandsCountsAsMiss() {
        WeaponBands shortDial = new WeaponBands(5, 45, 60, 100, 50);

        assertEquals(HitZone.CRIT, resolver.resolve(259, shortDial, 0));
        assertEquals(HitZone.MISS, resolver.resolve(260, shortDial, 0));
        assertEquals(HitZone.MISS, resolver.resolve(359, shortDial, 0));
    }

    @Test
    void zeroAccuracyKeepsBandsUnchanged() {
        assertEquals(WeaponBands.DEFAULT, resolver.scaleBands(WeaponBands.DEFAULT, 0));
    }

    @Test
    void accuracyShrinksInjureAndMissAndRedistributesProportionally() {
        WeaponBands scaled = resolver.scaleBands(WeaponBands.DEFAULT, 1.0);
        double scale = 1 + 0.40 * 1.0 / 1.8;

        assertEquals(5 / scale, scaled.injure(), 1e-9);
        assertEquals(45 / scale, scaled.miss(), 1e-9);
        assertEquals(WeaponBands.DEFAULT.total(), scaled.total(), 1e-9);
        assertTrue(scaled.crit() > 50);
        assertEquals(60.0 / 200.0, scaled.graze() / scaled.normal(), 1e-9);
        assertEquals(50.0 / 200.0, scaled.crit() / scaled.normal(), 1e-9);
    }

    @Test
    void higherAccuracyNeverWidensFailureZones() {
        WeaponBands low = resolver.scaleBands(WeaponBands.DEFAULT, 0.2);
        WeaponBands high = resolver.scaleBands(WeaponBands.DEFAULT, 0.9);

        assertTrue(high.injure() + high.miss() < low.injure() + low.miss());
        assertTrue(low.injure() + low.miss() < 50);
    }

    @Test
    void narrowZonesStopAtMinimumWidth() {
        WeaponBands narrow = new WeaponBands(1, 2, 60, 247, 50);

        // injure 本來就比下限窄，miss 縮到下限 2° 即停，沒有釋出角度
        assertEquals(narrow, resolver.scaleBands(narrow, 1.0));
    }

    @Test
    void enemyRollUsesDefaultDial() {
        assertEquals(HitZone.NORMAL, resolver.roll(0, ScriptedRandom.strict(0.5)));
        assertEquals(HitZone.CRIT, resolver.roll(0, ScriptedRandom.strict(0.999)));
        assertEquals(HitZone.INJURE, resolver.roll(0, ScriptedRandom.strict(0.0)));
    }

    @Test
    void outOfRangeInputIsRejected() {
        assertThrows(ValidationException.class, () -> resolver.resolve(360, WeaponBands.DEFAULT, 0));
        assertThrows(ValidationException.class, () -> resolver.resolve(-1, WeaponBands.DEFAULT, 0));
        assertThrows(ValidationException.class, () -> resolver.resolve(Double.NaN, WeaponBands.DEFAULT, 0));
        assertThrows(ValidationException.class, () -> resolver.resolve(10, WeaponBands.DEFAULT, 1.5));
        assertThrows(ValidationException.class, () -> resolver.scaleBands(WeaponBands.DEFAULT, -0.1));
    }

    @Test
    void bandsOverAFullCircleAreRejected() {
        assertThrows(ValidationException.class, () -> new WeaponBands(10, 50, 100, 150, 60));
        assertThrows(ValidationException.class, () -> new WeaponBands(-1, 50, 100, 150, 60));
    }
}
