package com.questrail.navigation.config;

import com.questrail.navigation.api.Position;
import com.questrail.navigation.protocol.step.StepTimingPolicy;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Aggregated configuration for one navigation run.
 *
 * @param mapDirectory      directory holding map files
 * @param mapName           map file name, resolved against {@code mapDirectory}
 * @param start             start position; overrides any start marker in the map
 * @param goal              goal position; overrides any goal marker in the map
 * @param controllerEnabled whether each step is exchanged with an external controller
 * @param targetEndpoint    controller address commands are sent to
 * @param responseEndpoint  local address acknowledgements are received on
 * @param timingPolicy      acknowledgement and start-up bounds
 * @param maxSteps          extra bound on directional moves; {@code 0} for none
 */
public record NavigationConfig(
    Path mapDirectory,
    String mapName,
    Position start,
    Position goal,
    boolean controllerEnabled,
    InetSocketAddress targetEndpoint,
    InetSocketAddress responseEndpoint,
    StepTimingPolicy timingPolicy,
    int maxSteps
) {
    public static final Path DEFAULT_MAP_DIRECTORY = Path.of("maps");
    public static final String DEFAULT_MAP_NAME = "map11.csv";
    public static final Position DEFAULT_START = new Position(2, 2);
    public static final Position DEFAULT_GOAL = new Position(21, 19);
    public static final InetSocketAddress DEFAULT_TARGET = new InetSocketAddress("127.0.0.1", 10000);
    public static final InetSocketAddress DEFAULT_RESPONSE = new InetSocketAddress("127.0.0.1", 10001);

    public NavigationConfig {
        Objects.requireNonNull(mapDirectory, "mapDirectory");
        Objects.requireNonNull(mapName, "mapName");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(targetEndpoint, "targetEndpoint");
        Objects.requireNonNull(responseEndpoint, "responseEndpoint");
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (mapName.isBlank()) {
            throw new IllegalArgumentException("mapName must not be blank");
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative");
        }
    }

    /**
     * Full path of the map file.
     */
    public Path mapPath() {
        return mapDirectory.resolve(mapName);
    }

    public static NavigationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path mapDirectory = DEFAULT_MAP_DIRECTORY;
        private String mapName = DEFAULT_MAP_NAME;
        private Position start = DEFAULT_START;
        private Position goal = DEFAULT_GOAL;
        private boolean controllerEnabled = false;
        private InetSocketAddress targetEndpoint = DEFAULT_TARGET;
        private InetSocketAddress responseEndpoint = DEFAULT_RESPONSE;
        private StepTimingPolicy timingPolicy = StepTimingPolicy.defaults();
        private int maxSteps = 0;

        public Builder withMapDirectory(Path mapDirectory) {
            this.mapDirectory = mapDirectory;
            return this;
        }

        public Builder withMapName(String mapName) {
            this.mapName = mapName;
            return this;
        }

        public Builder withStart(Position start) {
            this.start = start;
            return this;
        }

        public Builder withGoal(Position goal) {
            this.goal = goal;
            return this;
        }

        public Builder withControllerEnabled(boolean enabled) {
            this.controllerEnabled = enabled;
            return this;
        }

        public Builder withTargetEndpoint(InetSocketAddress targetEndpoint) {
            this.targetEndpoint = targetEndpoint;
            return this;
        }

        public Builder withResponseEndpoint(InetSocketAddress responseEndpoint) {
            this.responseEndpoint = responseEndpoint;
            return this;
        }

        public Builder withTimingPolicy(StepTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public NavigationConfig build() {
            return new NavigationConfig(mapDirectory, mapName, start, goal, controllerEnabled,
                    targetEndpoint, responseEndpoint, timingPolicy, maxSteps);
        }
    }
}
