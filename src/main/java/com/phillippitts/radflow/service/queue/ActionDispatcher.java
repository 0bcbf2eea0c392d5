package com.phillippitts.radflow.service.queue;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.exception.ActionExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a request to the handler registered for its kind.
 */
@Component
public class ActionDispatcher {

    private static final Logger LOG = LogManager.getLogger(ActionDispatcher.class);

    private final Map<ActionKind, ActionHandler> handlers = new EnumMap<>(ActionKind.class);

    public ActionDispatcher(List<ActionHandler> all) {
        for (ActionHandler handler : all) {
            for (ActionKind kind : handler.kinds()) {
                ActionHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate handlers for " + kind + ": "
                            + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }
        LOG.info("Action handlers registered for {}", handlers.keySet());
    }

    public boolean supports(ActionKind kind) {
        return handlers.containsKey(kind);
    }

    /**
     * @throws ActionExecutionException if no handler is registered for the kind
     */
    public void dispatch(ActionRequest request) {
        ActionHandler handler = handlers.get(request.kind());
        if (handler == null) {
            throw new ActionExecutionException(request.kind(), "No handler for " + request.kind().displayName());
        }
        handler.handle(request);
    }
}
