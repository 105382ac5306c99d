package com.demo.coordination.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Reference to a responder picked by a moderator, either by display name or by id.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResponderRef {

    RefType type;
    String value;

    public static ResponderRef byName(String name) {
        return new ResponderRef(RefType.NAME, name.trim());
    }

    public static ResponderRef byId(String id) {
        return new ResponderRef(RefType.ID, id.trim());
    }

    public boolean matches(Responder responder) {
        if (type == RefType.ID) {
            return value.equals(responder.getId());
        }
        return responder.getName() != null && value.equalsIgnoreCase(responder.getName().trim());
    }

    public enum RefType {
        NAME, ID
    }
}
