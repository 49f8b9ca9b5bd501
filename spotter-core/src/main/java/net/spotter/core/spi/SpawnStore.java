package net.spotter.core.spi;

import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;

import java.util.List;

public interface SpawnStore {
    List<SpawnPoint> loadSpawnPoints() throws Exception;

    void saveSighting(Sighting sighting) throws Exception;

    /** spawnId 기준 멱등 upsert */
    void saveSpawnPoint(SpawnPoint point) throws Exception;

    /** 저장소 없이 돌릴 때 */
    static SpawnStore none() {
        return new SpawnStore() {
            @Override public List<SpawnPoint> loadSpawnPoints() { return List.of(); }
            @Override public void saveSighting(Sighting sighting) {}
            @Override public void saveSpawnPoint(SpawnPoint point) {}
        };
    }
}
