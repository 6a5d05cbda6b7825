package space.ketterling.congestion.forecast;

import space.ketterling.congestion.model.ForecastSet;

/**
 * Receives freshly computed forecasts for storage.
 */
public interface ForecastSink {

    void store(String locationId, ForecastSet set, String modelType, String modelVersion) throws Exception;
}
