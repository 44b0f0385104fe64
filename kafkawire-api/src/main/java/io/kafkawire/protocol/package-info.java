/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
/**
 * The Kafka protocol message model: requests, responses and the values they carry.
 */
@DefaultAnnotation(NonNull.class)
package io.kafkawire.protocol;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.NonNull;
