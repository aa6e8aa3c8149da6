package com.productvideo.matching.shared.bus;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface EventHandler {
    void handle(JsonNode payload) throws Exception;
}
