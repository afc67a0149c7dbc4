package com.eainde.dialog.workflow;

import com.eainde.dialog.edges.Router;

import java.util.Objects;
import java.util.Set;

/**
 * Outgoing edge of a node: either a fixed target or a {@link Router} choosing among its declared targets.
 */
public record EdgeDefinition(String source, String target, Router router) {

    public EdgeDefinition {
        Objects.requireNonNull(source, "source");
        if ((target == null) == (router == null)) {
            throw new IllegalArgumentException("Edge from '" + source + "' needs exactly one of target or router");
        }
    }

    public static EdgeDefinition direct(String source, String target) {
        return new EdgeDefinition(source, target, null);
    }

    public static EdgeDefinition conditional(String source, Router router) {
        return new EdgeDefinition(source, null, router);
    }

    public boolean isConditional() {
        return router != null;
    }

    public Set<String> possibleTargets() {
        return isConditional() ? router.targets() : Set.of(target);
    }
}
