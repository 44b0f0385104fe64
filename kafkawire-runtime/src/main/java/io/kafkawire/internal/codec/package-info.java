/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
/**
 * Encoders and decoders of the Kafka wire protocol.
 */
@DefaultAnnotation(NonNull.class)
package io.kafkawire.internal.codec;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.NonNull;
