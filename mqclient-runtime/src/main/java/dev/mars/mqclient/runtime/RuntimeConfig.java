package dev.mars.mqclient.runtime;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Selects which broker adapters the runtime registers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public final class RuntimeConfig {

    private final boolean enablePulsar;
    private final boolean enableRabbitMq;
    private final boolean enableGcp;
    private final boolean enableNats;

    private RuntimeConfig(Builder builder) {
        this.enablePulsar = builder.enablePulsar;
        this.enableRabbitMq = builder.enableRabbitMq;
        this.enableGcp = builder.enableGcp;
        this.enableNats = builder.enableNats;
    }

    public boolean isPulsarEnabled() {
        return enablePulsar;
    }

    public boolean isRabbitMqEnabled() {
        return enableRabbitMq;
    }

    public boolean isGcpEnabled() {
        return enableGcp;
    }

    public boolean isNatsEnabled() {
        return enableNats;
    }

    /**
     * Creates a new builder with every adapter enabled.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static RuntimeConfig defaults() {
        return builder().build();
    }

    public static final class Builder {
        private boolean enablePulsar = true;
        private boolean enableRabbitMq = true;
        private boolean enableGcp = true;
        private boolean enableNats = true;

        private Builder() {}

        public Builder enablePulsar(boolean enable) {
            this.enablePulsar = enable;
            return this;
        }

        public Builder enableRabbitMq(boolean enable) {
            this.enableRabbitMq = enable;
            return this;
        }

        public Builder enableGcp(boolean enable) {
            this.enableGcp = enable;
            return this;
        }

        public Builder enableNats(boolean enable) {
            this.enableNats = enable;
            return this;
        }

        public RuntimeConfig build() {
            return new RuntimeConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "enablePulsar=" + enablePulsar +
                ", enableRabbitMq=" + enableRabbitMq +
                ", enableGcp=" + enableGcp +
                ", enableNats=" + enableNats +
                '}';
    }
}
