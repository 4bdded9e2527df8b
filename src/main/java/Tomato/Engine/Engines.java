package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Index.TransitionIndexes;
import Tomato.Model.MachineDefinition;
import Tomato.Model.MachineValidator;
import Tomato.Model.RunOptions;
import Tomato.Trace.RunResult;

/**
 * Entry point: validates a definition and picks the engine for its model.
 */
public final class Engines {

    private Engines() {
    }

    /**
     * @throws Tomato.Model.InvalidMachineException if the definition does not validate
     */
    public static Engine forDefinition(MachineDefinition definition) {
        MachineValidator.validate(definition);
        TransitionIndex index = TransitionIndexes.of(definition);
        return switch (definition.type()) {
            case DFA -> new DfaEngine(definition, index);
            case NFA -> new NfaEngine(definition, index);
            case PDA -> new PdaEngine(definition, index);
            case TURING -> new TuringEngine(definition, index);
            case MEALY, MOORE -> new TransducerEngine(definition, index);
        };
    }

    public static DfaEngine dfa(MachineDefinition definition) {
        return cast(definition, DfaEngine.class);
    }

    public static NfaEngine nfa(MachineDefinition definition) {
        return cast(definition, NfaEngine.class);
    }

    public static PdaEngine pda(MachineDefinition definition) {
        return cast(definition, PdaEngine.class);
    }

    public static TuringEngine turing(MachineDefinition definition) {
        return cast(definition, TuringEngine.class);
    }

    public static TransducerEngine transducer(MachineDefinition definition) {
        return cast(definition, TransducerEngine.class);
    }

    /**
     * Validate, tokenize {@code input} against the machine's alphabet and run to the end.
     */
    public static RunResult run(MachineDefinition definition, String input, RunOptions options) {
        return forDefinition(definition).run(input, options);
    }

    private static <E extends Engine> E cast(MachineDefinition definition, Class<E> type) {
        Engine engine = forDefinition(definition);
        if (!type.isInstance(engine)) {
            throw new IllegalArgumentException(definition.type() + " machines are not run by " + type.getSimpleName());
        }
        return type.cast(engine);
    }
}
