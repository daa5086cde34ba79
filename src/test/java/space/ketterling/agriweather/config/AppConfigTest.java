package space.ketterling.agriweather.config;

import org.junit.jupiter.api.Test;
import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.HeatStressLevel;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    @Test
    void emptyPropertiesGiveDefaults() {
        AppConfig cfg = AppConfig.fromProperties(new Properties());

        assertEquals(8080, cfg.apiPort());
        assertEquals(CacheSettings.defaults(), cfg.cache());
        assertEquals(ForecastSettings.defaults(), cfg.forecast());
        assertEquals(AlertThresholds.defaults(), cfg.alerts());
        assertEquals(10.0, cfg.defaultRadiusKm());
        assertEquals(new CropProfile(CropProfile.GENERIC, 10, 30, 70), cfg.defaultCrop());
        assertEquals(4, cfg.cropProfiles().size());
        assertEquals(Duration.ofHours(4), cfg.alertEvaluation());
        assertEquals(ZoneId.of("Asia/Kolkata"), cfg.clockZoneId());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("api.port", "9090");
        p.setProperty("cache.currentTtl", "PT1M");
        p.setProperty("cache.degradedAvailabilityOnBackendFailure", "true");
        p.setProperty("forecast.maxHorizonDays", "10");
        p.setProperty("alerts.heatAdvisoryLevel", " severe ");
        p.setProperty("alerts.irrigationDryDays", "5");
        p.setProperty("crops.profiles", "wheat:5:20:60");
        p.setProperty("clock.zone", "UTC");

        AppConfig cfg = AppConfig.fromProperties(p);

        assertEquals(9090, cfg.apiPort());
        assertEquals(Duration.ofMinutes(1), cfg.cache().currentTtl());
        assertTrue(cfg.cache().degradedAvailabilityOnBackendFailure());
        assertEquals(10, cfg.forecast().maxHorizonDays());
        assertEquals(HeatStressLevel.SEVERE, cfg.alerts().heatAdvisoryLevel());
        assertEquals(5, cfg.alerts().irrigationDryDays());
        assertEquals(List.of(new CropProfile("WHEAT", 5, 20, 60)), cfg.cropProfiles());
        assertEquals(ZoneId.of("UTC"), cfg.clockZoneId());
    }

    @Test
    void malformedDurationIsRejected() {
        Properties p = new Properties();
        p.setProperty("cache.forecastTtl", "three hours");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("cache.forecastTtl"));
    }

    @Test
    void lookbackShorterThanDryRunIsRejected() {
        Properties p = new Properties();
        p.setProperty("alerts.irrigationDryDays", "10");

        assertThrows(IllegalArgumentException.class, () -> AppConfig.fromProperties(p));
    }

    @Test
    void parsesCropProfileLists() {
        List<CropProfile> crops = AppConfig.parseCrops(" tomato:10:15:70 | |potato:7:30:70");

        assertEquals(2, crops.size());
        assertEquals("TOMATO", crops.get(0).cropId());
        assertEquals(15.0, crops.get(0).dryBelowPct());
        assertTrue(AppConfig.parseCrops("  ").isEmpty());
        assertThrows(IllegalStateException.class, () -> AppConfig.parseCrops("TOMATO:10:15"));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parseCrops("TOMATO:10:80:70"));
    }

    @Test
    void cropProfilesMayCarryTemperatureAndHumidityRanges() {
        List<CropProfile> crops = AppConfig.parseCrops("tomato:10:30:70:18:32:50:80|wheat:5:20:60");

        CropProfile tomato = crops.get(0);
        assertEquals(18.0, tomato.minTemperatureC());
        assertEquals(32.0, tomato.maxTemperatureC());
        assertEquals(50.0, tomato.minHumidityPct());
        assertEquals(80.0, tomato.maxHumidityPct());
        assertEquals(CropProfile.DEFAULT_MAX_TEMPERATURE_C, crops.get(1).maxTemperatureC());

        assertThrows(IllegalStateException.class, () -> AppConfig.parseCrops("TOMATO:10:30:70:18:32"));
        assertThrows(IllegalStateException.class, () -> AppConfig.parseCrops("TOMATO:10:30:warm"));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parseCrops("TOMATO:10:30:70:32:18:50:80"));
    }
}
