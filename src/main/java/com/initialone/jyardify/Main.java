package com.initialone.jyardify;

import com.initialone.jyardify.commands.*;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jyardify",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Add YARD documentation comments to Ruby sources with LLMs.",
                "",
                "Providers: openai | anthropic | gemini | deepseek | local | mock",
                "Env: LLM_PROVIDER, OPENAI_API_KEY / OPENAI_BASE_URL, ANTHROPIC_API_KEY / ANTHROPIC_BASE_URL,",
                "     GEMINI_API_KEY (or GOOGLE_API_KEY) / GEMINI_BASE_URL,",
                "     DEEPSEEK_API_KEY / DEEPSEEK_BASE_URL, LOCAL_LLM_API_KEY"
        },
        subcommands = {
                GenerateCmd.class, StatusCmd.class
        }
)
public class Main implements Runnable {
    public void run() { System.out.println("Use a subcommand. Try --help."); }
    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
