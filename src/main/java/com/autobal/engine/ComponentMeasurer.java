package com.autobal.engine;

import com.autobal.model.CandidateRun;
import com.autobal.model.DetectionSettings;
import com.autobal.model.TroughComponent;
import com.autobal.model.WavelengthGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies the minimum-width gate to a closed run and measures the accepted ones.
 */
public class ComponentMeasurer {

    private static final Logger log = LoggerFactory.getLogger(ComponentMeasurer.class);

    private final DetectionSettings settings;

    public ComponentMeasurer(DetectionSettings settings) {
        this.settings = settings;
    }

    /**
     * @return the measured component, or empty if the run is not wider than the minimum width
     */
    public Optional<TroughComponent> measure(CandidateRun run, double[] transmission, WavelengthGrid grid) {
        double step = grid.step();
        double widthAngstroms = run.length() * step;
        if (widthAngstroms <= settings.minWidthAngstroms()) {
            log.debug("Rejected run [{}, {}): width {} Å <= {} Å",
                    run.start(), run.end(), widthAngstroms, settings.minWidthAngstroms());
            return Optional.empty();
        }

        // Left-endpoint rectangle rule on the fixed grid step.
        double equivalentWidth = 0;
        for (int k = run.start(); k < run.end(); k++) {
            equivalentWidth += (1 - transmission[k]) * step;
        }

        double depth = 1 - transmission[run.minIndex()];
        double centroidWavelength = grid.at(run.minIndex());
        double centroidVelocity = settings.velocityOf(centroidWavelength);

        double lastVelocity = settings.velocityOf(grid.at(run.end() - 1));
        double firstVelocity = settings.velocityOf(grid.at(run.start()));
        double velocityExtent = Math.abs(firstVelocity - lastVelocity);

        return Optional.of(new TroughComponent(run.start(), run.end(), equivalentWidth, depth,
                centroidWavelength, centroidVelocity, velocityExtent));
    }

    public DetectionSettings getSettings() {
        return settings;
    }
}
