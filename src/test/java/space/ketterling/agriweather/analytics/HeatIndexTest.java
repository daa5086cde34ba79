package space.ketterling.agriweather.analytics;

import org.junit.jupiter.api.Test;
import space.ketterling.agriweather.model.HeatStressLevel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HeatIndexTest {

    @Test
    void mildConditionsUseSimpleFormula() {
        // 77F at 50% stays in the Steadman range
        assertEquals(76.75, HeatIndex.fahrenheit(77.0, 50.0), 1e-9);
        assertEquals(24.861, HeatIndex.celsius(25.0, 50.0), 0.001);
    }

    @Test
    void hotConditionsUseRothfuszRegression() {
        assertEquals(94.60, HeatIndex.fahrenheit(90.0, 50.0), 0.01);
        assertEquals(45.05, HeatIndex.celsius(35.0, 60.0), 0.01);
        assertEquals(48.60, HeatIndex.celsius(38.0, 50.0), 0.01);
    }

    @Test
    void lowHumidityAdjustmentLowersTheIndex() {
        double t = 95.0;
        double unadjusted = -42.379 + 2.04901523 * t + 10.14333127 * 10 - 0.22475541 * t * 10
                - 0.00683783 * t * t - 0.05481717 * 100 + 0.00122874 * t * t * 10
                + 0.00085282 * t * 100 - 0.00000199 * t * t * 100;
        assertEquals(unadjusted - 0.75, HeatIndex.fahrenheit(t, 10.0), 1e-9);
    }

    @Test
    void highHumidityAdjustmentRaisesTheIndex() {
        double t = 85.0;
        double rh = 90.0;
        double unadjusted = -42.379 + 2.04901523 * t + 10.14333127 * rh - 0.22475541 * t * rh
                - 0.00683783 * t * t - 0.05481717 * rh * rh + 0.00122874 * t * t * rh
                + 0.00085282 * t * rh * rh - 0.00000199 * t * t * rh * rh;
        assertEquals(unadjusted + 0.2, HeatIndex.fahrenheit(t, rh), 1e-9);
    }

    @Test
    void levelsFollowNwsBands() {
        assertEquals(HeatStressLevel.NONE, HeatIndex.level(HeatIndex.celsius(30.0, 40.0)));
        assertEquals(HeatStressLevel.MODERATE, HeatIndex.level(HeatIndex.celsius(32.2222, 50.0)));
        assertEquals(HeatStressLevel.SEVERE, HeatIndex.level(HeatIndex.celsius(35.0, 60.0)));
        assertEquals(HeatStressLevel.EXTREME, HeatIndex.level(HeatIndex.celsius(40.0, 60.0)));
    }

    @Test
    void outOfRangeHumidityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> HeatIndex.celsius(30.0, 120.0));
        assertThrows(IllegalArgumentException.class, () -> HeatIndex.celsius(Double.NaN, 50.0));
    }
}
