package com.questrail.tao.config;

import com.questrail.tao.internal.time.SystemWallClock;
import com.questrail.tao.internal.time.WallClock;
import com.questrail.tao.observability.NullObservabilitySink;
import com.questrail.tao.observability.TaoObservabilitySink;
import com.questrail.tao.protocol.command.CommandLog;
import com.questrail.tao.protocol.command.NullCommandLog;
import com.questrail.tao.protocol.decode.DecodeStrictness;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for a Tao session.
 *
 * <p>{@code strictness} has no default: a builder without
 * {@link Builder#withStrictness(DecodeStrictness)} refuses to build.</p>
 */
public record TaoSessionConfig(
    List<Object> initArgs,
    DecodeStrictness strictness,
    CommandLog commandLog,
    TaoObservabilitySink observabilitySink,
    int defaultMatrixColumns,
    WallClock wallClock
) {
    public TaoSessionConfig {
        initArgs = List.copyOf(Objects.requireNonNull(initArgs, "initArgs"));
        Objects.requireNonNull(strictness, "strictness");
        Objects.requireNonNull(commandLog, "commandLog");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
        if (defaultMatrixColumns < 1) {
            throw new IllegalArgumentException("defaultMatrixColumns must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Object> initArgs = new ArrayList<>();
        private DecodeStrictness strictness;
        private CommandLog commandLog = NullCommandLog.INSTANCE;
        private TaoObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private int defaultMatrixColumns = 2;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        /**
         * Appends engine start-up switches, e.g. {@code "-lat", "ring.bmad", "-noplot"}.
         */
        public Builder withInitArgs(Object... args) {
            initArgs.addAll(Arrays.asList(args));
            return this;
        }

        public Builder withStrictness(DecodeStrictness strictness) {
            this.strictness = strictness;
            return this;
        }

        public Builder withCommandLog(CommandLog commandLog) {
            this.commandLog = commandLog;
            return this;
        }

        public Builder withObservabilitySink(TaoObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withDefaultMatrixColumns(int columns) {
            this.defaultMatrixColumns = columns;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public TaoSessionConfig build() {
            if (strictness == null) {
                throw new IllegalStateException("Decode strictness must be chosen explicitly");
            }
            return new TaoSessionConfig(initArgs, strictness, commandLog, observabilitySink,
                    defaultMatrixColumns, wallClock);
        }
    }
}
