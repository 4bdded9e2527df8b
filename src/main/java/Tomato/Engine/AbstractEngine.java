package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.MachineDefinition;

abstract class AbstractEngine implements Engine {
    protected final MachineDefinition definition;
    protected final TransitionIndex index;

    AbstractEngine(MachineDefinition definition, TransitionIndex index) {
        this.definition = definition;
        this.index = index;
    }

    @Override
    public MachineDefinition definition() {
        return definition;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + definition + "]";
    }
}
