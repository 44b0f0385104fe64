/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import edu.umd.cs.findbugs.annotations.Nullable;

public record Broker(int nodeId, @Nullable String host, int port) {}
