package com.ryuqq.discovery.testkit.collaborator;

import com.ryuqq.discovery.core.guard.ExecutionGuard;
import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.outcome.CollaboratorOutcome;
import com.ryuqq.discovery.core.outcome.Success;
import com.ryuqq.discovery.core.spi.Collaborator;
import com.ryuqq.discovery.core.spi.StageInput;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Collaborator that plays back a script of responses and records every input it saw.
 *
 * <p>Each invocation consumes the next scripted step. Once the script is exhausted the
 * fallback step is used (by default a {@link Success} echoing the stage name and
 * iteration).</p>
 *
 * <pre>
 * ScriptedCollaborator analysis = ScriptedCollaborator.named("analysis")
 *     .thenReturn(new Partial(Payload.of("{}"), failures))
 *     .thenThrow(new ExhaustedException(llm, 3, cause));
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class ScriptedCollaborator implements Collaborator {

    private final String name;
    private final Deque<BiFunction<StageInput, ExecutionGuard, CollaboratorOutcome>> script = new ArrayDeque<>();
    private final List<StageInput> inputs = new ArrayList<>();
    private BiFunction<StageInput, ExecutionGuard, CollaboratorOutcome> fallback;

    private ScriptedCollaborator(String name) {
        this.name = name;
        this.fallback = (input, guard) -> Success.of(
            Payload.of("{\"stage\":\"" + name + "\",\"iteration\":" + input.iteration() + "}"));
    }

    public static ScriptedCollaborator named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return new ScriptedCollaborator(name);
    }

    public synchronized ScriptedCollaborator thenReturn(CollaboratorOutcome outcome) {
        script.addLast((input, guard) -> outcome);
        return this;
    }

    public synchronized ScriptedCollaborator thenThrow(RuntimeException failure) {
        script.addLast((input, guard) -> {
            throw failure;
        });
        return this;
    }

    /**
     * Adds a step that runs arbitrary logic, typically calls through the guard.
     *
     * @param step the step
     * @return this
     */
    public synchronized ScriptedCollaborator thenAnswer(
            BiFunction<StageInput, ExecutionGuard, CollaboratorOutcome> step) {
        script.addLast(step);
        return this;
    }

    public synchronized ScriptedCollaborator otherwise(
            BiFunction<StageInput, ExecutionGuard, CollaboratorOutcome> step) {
        this.fallback = step;
        return this;
    }

    @Override
    public CollaboratorOutcome invoke(StageInput input, ExecutionGuard guard) {
        BiFunction<StageInput, ExecutionGuard, CollaboratorOutcome> step;
        synchronized (this) {
            inputs.add(input);
            step = script.isEmpty() ? fallback : script.pollFirst();
        }
        return step.apply(input, guard);
    }

    public synchronized List<StageInput> inputs() {
        return List.copyOf(inputs);
    }

    public synchronized int invocationCount() {
        return inputs.size();
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "ScriptedCollaborator{" + name + '}';
    }
}
