package cli;

import application.ProgressListener;

import java.io.PrintStream;

/**
 * {@link ProgressListener} that prints each notification as one line.
 *
 * <p>The command line uses stderr so progress never mixes with the result table.
 */
public final class ConsoleProgressListener implements ProgressListener {

    private final PrintStream out;

    public ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onProgress(String message) {
        out.println(message);
        out.flush();
    }
}
