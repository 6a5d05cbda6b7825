package space.ketterling.congestion.forecast;

import space.ketterling.congestion.model.Location;

import java.util.Optional;

public interface LocationLookup {

    Optional<Location> find(String locationId) throws Exception;
}
