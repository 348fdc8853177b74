package mailtask;

import mailtask.cli.MailTaskCommand;
import picocli.CommandLine;

public final class App {
    private App() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MailTaskCommand()).execute(args);
        System.exit(code);
    }
}
