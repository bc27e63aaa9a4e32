package cli;

import app.SqlEvalCliApp;

/**
 * CLI entrypoint facade. The orchestration lives in {@link SqlEvalCliApp}.
 */
public class SqlEvalCli {

    public static void main(String[] args) {
        SqlEvalCliApp.main(args);
    }
}
