package com.routewise.core.handler;

import com.routewise.core.model.HandlerDescriptor;
import com.routewise.core.model.Task;
import com.routewise.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Default executor for descriptors that have no dedicated {@link Handler} bean.
 * <p>
 * Accepts every task and echoes the handler's declared capabilities back, so a
 * descriptor-only configuration is routable end to end.
 */
public class AcknowledgingHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgingHandler.class);

    private final HandlerDescriptor descriptor;

    public AcknowledgingHandler(HandlerDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public TaskResult execute(Task task) {
        log.debug("Handler {} acknowledging task {}", descriptor.id(), task.id());
        return new TaskResult(
                descriptor.id() + " accepted task " + (task.id() != null ? task.id() : "(unnamed)"),
                Map.of(
                        "handler", descriptor.id(),
                        "capabilities", List.copyOf(descriptor.capabilities()),
                        "description", task.description()),
                Map.of());
    }
}
