/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;

import io.kafkawire.protocol.ApiKey;

/**
 * A whole response frame whose API is already known, holding the body that follows the correlation id.
 */
public final class BufferResponseFrame extends DefaultByteBufHolder {

    private final ApiKey apiKey;
    private final int correlationId;

    public BufferResponseFrame(ApiKey apiKey, int correlationId, ByteBuf body) {
        super(body);
        this.apiKey = apiKey;
        this.correlationId = correlationId;
    }

    public ApiKey apiKey() {
        return apiKey;
    }

    public int correlationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "BufferResponseFrame(apiKey=" + apiKey + ", correlationId=" + correlationId + ", body=" + content() + ')';
    }
}
