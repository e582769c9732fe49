package com.stockgame.exception;

import java.util.Map;

/** A game, player, stock, market event or corporate action that the request names does not exist. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String id) {
        super(ErrorCode.NOT_FOUND, resourceType + " '" + id + "' does not exist", Map.of("type", resourceType, "id", id));
    }
}
