package pda.simulation;

import pda.automaton.Automaton;

import java.util.Locale;

/**
 * Enumerations for acceptance modes, run outcomes and the engine life cycle.
 */
public class SimulationEnums {

    /**
     * When a configuration counts as accepting. All modes require the whole input consumed.
     */
    public enum AcceptanceMode {
        FINAL_STATE {
            @Override
            public boolean accepts(Automaton automaton, Configuration config) {
                return config.isInputEmpty() && automaton.isFinal(config.getState());
            }
        },
        EMPTY_STACK {
            @Override
            public boolean accepts(Automaton automaton, Configuration config) {
                return config.isInputEmpty() && config.getStack().isEmpty();
            }
        },
        BOTH {
            @Override
            public boolean accepts(Automaton automaton, Configuration config) {
                return FINAL_STATE.accepts(automaton, config) && EMPTY_STACK.accepts(automaton, config);
            }
        };

        public abstract boolean accepts(Automaton automaton, Configuration config);

        /**
         * Lower-case name as used in files and on the command line ({@code final_state}, ...).
         */
        public String externalName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Parse {@code final_state}, {@code final-state}, {@code FINAL_STATE}, ...
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static AcceptanceMode parse(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Acceptance mode is empty");
            }
            String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            try {
                return AcceptanceMode.valueOf(normalized);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown acceptance mode '" + value
                        + "' (expected final_state, empty_stack or both)", ex);
            }
        }
    }

    public enum Outcome { ACCEPTED, REJECTED, INCONCLUSIVE }

    /**
     * Life cycle of one run. READY and SEARCHING are transient; the last three are terminal.
     */
    public enum EngineState { READY, SEARCHING, ACCEPTED, REJECTED, INCONCLUSIVE }
}
