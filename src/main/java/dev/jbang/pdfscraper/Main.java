package dev.jbang.pdfscraper;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "archive-pdf-scraper",
		version = "1.0.0",
		description = "Finds and downloads the PDF documents published on a tournament archive site",
		mixinStandardHelpOptions = true,
		subcommands = {ScrapeCommand.class, DiscoverCommand.class, StatusCommand.class})
public class Main implements Callable<Integer> {
	static final int EXIT_OK = 0;
	static final int EXIT_FAILURES = 1;
	static final int EXIT_FATAL = 2;

	@Spec
	CommandSpec spec;

	/** Without a subcommand, scrape with the default settings */
	@Override
	public Integer call() {
		return spec.commandLine().getSubcommands().get("scrape").execute();
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
