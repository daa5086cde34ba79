package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.model.CropProfile;

import java.util.Optional;

/**
 * Supplies per-crop thresholds.
 */
public interface CropProfileProvider {

    Optional<CropProfile> find(String cropId);

    /**
     * Thresholds used when the caller names no crop.
     */
    CropProfile defaultProfile();

    /**
     * Default profile for a null or blank id, otherwise the named profile.
     *
     * @throws NotFoundException when the crop is unknown
     */
    default CropProfile resolve(String cropId) {
        if (cropId == null || cropId.isBlank())
            return defaultProfile();
        return find(cropId).orElseThrow(() -> new NotFoundException("unknown crop: " + cropId));
    }
}
