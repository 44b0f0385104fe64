/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.config;

import java.util.Objects;
import java.util.Optional;

/**
 * The top level of a kafkawire configuration file.
 * @param client settings of a client connection
 * @param server settings of a server
 * @param netty settings of the Netty event loops
 */
public record Configuration(Optional<ClientSettings> client,
                            Optional<ServerSettings> server,
                            Optional<NettySettings> netty) {

    public Configuration {
        client = Objects.requireNonNullElse(client, Optional.empty());
        server = Objects.requireNonNullElse(server, Optional.empty());
        netty = Objects.requireNonNullElse(netty, Optional.empty());
    }

    public NettySettings activeNettySettings() {
        return netty.orElseGet(NettySettings::defaults);
    }
}
