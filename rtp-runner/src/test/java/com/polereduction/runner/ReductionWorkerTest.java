package com.polereduction.runner;

import com.polereduction.core.exceptions.NumericalInstabilityException;
import com.polereduction.core.filter.ReductionToPole;
import com.polereduction.core.model.FieldGeometry;
import com.polereduction.core.model.Profile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ReductionWorker}.
 */
class ReductionWorkerTest {

    private final ReductionToPole reduction = ReductionToPole.withDefaults();
    private final ReductionWorker worker = new ReductionWorker(reduction);

    private static Profile gaussian(int n) {
        double[] distance = new double[n];
        double[] anomaly = new double[n];
        for (int i = 0; i < n; i++) {
            distance[i] = i * 10.0;
            double u = (i - n / 2.0) / 6.0;
            anomaly[i] = 100.0 * Math.exp(-u * u);
        }
        return Profile.of(distance, anomaly);
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    @Test
    @DisplayName("Should complete with the synchronous result and report progress")
    void shouldMatchSynchronousResult() throws Exception {
        Profile profile = gaussian(64);
        FieldGeometry geometry = FieldGeometry.of(42.3, 0.9719, 90.0);
        List<Integer> progress = new CopyOnWriteArrayList<>();

        double[] result = worker.submit(profile, 10.0, geometry, false, progress::add)
                .get(10, TimeUnit.SECONDS);

        assertThat(result).containsExactly(reduction.reduce(profile, 10.0, geometry), within(1e-12));
        assertThat(progress).containsExactly(10, 90, 100);
    }

    @Test
    @DisplayName("Mirror flag should negate the result")
    void shouldMirror() throws Exception {
        Profile profile = gaussian(40);
        FieldGeometry geometry = FieldGeometry.of(60.0, 5.0, 30.0);

        double[] plain = worker.submit(profile, 5.0, geometry, false, ProgressListener.NONE).get();
        double[] mirrored = worker.submit(profile, 5.0, geometry, true, ProgressListener.NONE).get();

        assertThat(mirrored).containsExactly(ReductionToPole.mirror(plain), within(1e-12));
    }

    @Test
    @DisplayName("Typed failures should surface as the future's cause")
    void shouldPropagateFailure() {
        List<Integer> progress = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> worker.submit(gaussian(16), 10.0, FieldGeometry.of(0.0, 0.0, 90.0),
                false, progress::add).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(NumericalInstabilityException.class);
        assertThat(progress).containsExactly(10);
    }

    @Test
    @DisplayName("Closed worker should refuse new work")
    void shouldRefuseAfterClose() {
        worker.close();

        assertThat(worker.isClosed()).isTrue();
        assertThatThrownBy(() -> worker.submit(gaussian(8), 1.0, FieldGeometry.of(90.0, 0.0, 0.0),
                false, ProgressListener.NONE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }
}
