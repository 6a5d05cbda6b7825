package space.ketterling.congestion.training;

import org.junit.jupiter.api.Test;

import space.ketterling.congestion.model.FeatureSchema;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticTrainingDataSourceTest {

    @Test
    void generate_shouldProduceSchemaWidthRowsWithBoundedLabels() {
        TrainingData data = SyntheticTrainingDataSource.generate(500, 3L);

        assertEquals(500, data.size());
        assertEquals(SyntheticTrainingDataSource.NAME, data.source());
        for (int i = 0; i < data.size(); i++) {
            assertEquals(FeatureSchema.SIZE, data.rows()[i].length);
            assertTrue(data.labels()[i] >= 0 && data.labels()[i] <= 100);
            double hour = data.rows()[i][FeatureSchema.HOUR_OF_DAY];
            assertTrue(hour >= 0 && hour <= 23);
            double lag = data.rows()[i][FeatureSchema.CONGESTION_LAG_1H];
            assertTrue(lag >= 1 && lag <= 5);
        }
    }

    @Test
    void generate_shouldRepeatForSameSeed() {
        TrainingData a = SyntheticTrainingDataSource.generate(50, 11L);
        TrainingData b = SyntheticTrainingDataSource.generate(50, 11L);
        assertArrayEquals(a.labels(), b.labels());
        assertArrayEquals(a.rows()[49], b.rows()[49]);
    }

    @Test
    void prior_shouldFollowHourBands() {
        Random rnd = new Random(5);
        for (int i = 0; i < 100; i++) {
            double peak = SyntheticTrainingDataSource.prior(8, rnd);
            assertTrue(peak >= 60 && peak <= 90);
            double evening = SyntheticTrainingDataSource.prior(18, rnd);
            assertTrue(evening >= 65 && evening <= 95);
            double night = SyntheticTrainingDataSource.prior(2, rnd);
            assertTrue(night >= 5 && night <= 25);
            double lunch = SyntheticTrainingDataSource.prior(12, rnd);
            assertTrue(lunch >= 35 && lunch <= 60);
            double shoulder = SyntheticTrainingDataSource.prior(15, rnd);
            assertTrue(shoulder >= 25 && shoulder <= 50);
        }
    }

    @Test
    void constructor_shouldRejectNonPositiveSampleCount() {
        assertThrows(IllegalArgumentException.class, () -> new SyntheticTrainingDataSource(0, 1L));
    }
}
