package pda.interactive;

import pda.automaton.Transition;
import pda.render.StepView;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Line-oriented driver for a {@link StepSession}.
 *
 * Commands: a choice number takes that transition, {@code b} backtracks, {@code t} prints the
 * path so far, {@code q} quits. End of input also quits.
 */
public class StepConsole {

    private final StepSession session;
    private final BufferedReader in;
    private final Consumer<String> out;

    public StepConsole(StepSession session, BufferedReader in, Consumer<String> out) {
        this.session = session;
        this.in = in;
        this.out = out;
    }

    /**
     * Run until the user quits or input ends.
     *
     * @return whether the session finished on an accepting configuration
     */
    public boolean run() throws IOException {
        out.accept("Interactive stepping (mode=" + session.getMode().externalName()
                + "). Enter a number to choose, b to backtrack, t for the path, q to quit.");
        while (true) {
            show();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            String command = line.trim();
            if (command.isEmpty()) {
                continue;
            }
            if (command.equalsIgnoreCase("q")) {
                break;
            }
            if (command.equalsIgnoreCase("b")) {
                if (!session.backtrack()) {
                    out.accept("Already at the start configuration.");
                }
                continue;
            }
            if (command.equalsIgnoreCase("t")) {
                out.accept(StepView.renderTrace(session.trace()));
                continue;
            }
            choose(command);
        }
        boolean accepted = session.isAccepting();
        out.accept(accepted ? "Session ended on an accepting configuration." : "Session ended without acceptance.");
        return accepted;
    }

    private void show() {
        out.accept(StepView.RULE);
        out.accept(StepView.renderConfiguration(session.current()).trim());
        if (session.isAccepting()) {
            out.accept("** accepting configuration **");
        }
        List<Transition> choices = session.applicableTransitions();
        out.accept(StepView.renderChoices(choices));
    }

    private void choose(String command) {
        int index;
        try {
            index = Integer.parseInt(command) - 1;
        } catch (NumberFormatException ex) {
            out.accept("Unknown command '" + command + "'.");
            return;
        }
        try {
            session.apply(index);
        } catch (InvalidChoiceException ex) {
            out.accept(ex.getMessage() + ", choose again.");
        }
    }
}
