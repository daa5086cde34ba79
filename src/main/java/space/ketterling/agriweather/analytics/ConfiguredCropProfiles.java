package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.CropProfile;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Crop profiles taken from configuration. Lookups ignore case.
 */
public final class ConfiguredCropProfiles implements CropProfileProvider {
    private final CropProfile defaultProfile;
    private final Map<String, CropProfile> byId = new TreeMap<>();

    public ConfiguredCropProfiles(CropProfile defaultProfile, Collection<CropProfile> profiles) {
        this.defaultProfile = defaultProfile;
        for (CropProfile p : profiles) {
            byId.put(p.cropId().toUpperCase(Locale.ROOT), p);
        }
    }

    @Override
    public Optional<CropProfile> find(String cropId) {
        if (cropId == null)
            return Optional.empty();
        return Optional.ofNullable(byId.get(cropId.trim().toUpperCase(Locale.ROOT)));
    }

    @Override
    public CropProfile defaultProfile() {
        return defaultProfile;
    }
}
