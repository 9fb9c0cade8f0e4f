package com.cloudsec.transformer.validation;

import freemarker.template.TemplateException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line entry point for template validation
 *
 * <p>Exits 0 when every template is valid, 1 when any template is invalid and 2 on a usage or
 * I/O error.
 */
public class ValidateCli {
  public static final int EXIT_VALID = 0;
  public static final int EXIT_INVALID = 1;
  public static final int EXIT_USAGE = 2;

  private static Options options() {
    Options options = new Options();

    OptionGroup target = new OptionGroup();
    target.addOption(new Option("t", "template", true, "Validate a single template file"));
    target.addOption(
        new Option("d", "templates-dir", true, "Validate every *.yaml file in a directory"));
    target.setRequired(true);
    options.addOptionGroup(target);

    Option format = new Option("o", "output-format", true, "Report format, text or json");
    format.setArgName("format");
    options.addOption(format);

    options.addOption(
        new Option(null, "strict", false, "Stop validating a file at the first failing phase"));
    options.addOption(new Option(null, "no-strict", false, "Run every phase"));
    options.addOption(
        new Option(null, "warnings-as-errors", false, "Treat warnings as errors"));
    options.addOption(new Option(null, "no-color", false, "Disable coloured output"));
    return options;
  }

  private static void usage(Options options, PrintStream out) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter pw = new PrintWriter(out);
    fmt.printHelp(
        pw,
        HelpFormatter.DEFAULT_WIDTH,
        "ValidateCli",
        null,
        options,
        HelpFormatter.DEFAULT_LEFT_PAD,
        HelpFormatter.DEFAULT_DESC_PAD,
        null,
        true);
    pw.flush();
  }

  /**
   * Run validation
   *
   * @param args Command line arguments
   * @param out Report stream
   * @param color Colour output when not disabled on the command line
   * @return Exit status
   */
  public static int run(String[] args, PrintStream out, boolean color) {
    Options options = options();
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(options, args);
    } catch (ParseException exc) {
      out.println(exc.getMessage());
      usage(options, out);
      return EXIT_USAGE;
    }

    String format = cmd.getOptionValue("output-format", "text");
    if (!format.equals("text") && !format.equals("json")) {
      out.println(String.format("invalid output format: %s", format));
      usage(options, out);
      return EXIT_USAGE;
    }
    if (cmd.hasOption("strict") && cmd.hasOption("no-strict")) {
      out.println("--strict and --no-strict cannot be combined");
      usage(options, out);
      return EXIT_USAGE;
    }

    TemplateValidator validator =
        new TemplateValidator(!cmd.hasOption("no-strict"), cmd.hasOption("warnings-as-errors"));
    AggregatedValidationResult results;
    try {
      if (cmd.hasOption("template")) {
        results = new AggregatedValidationResult();
        results.add(validator.validateTemplate(cmd.getOptionValue("template")));
      } else {
        results = validator.validateDirectory(cmd.getOptionValue("templates-dir"));
      }
      ValidationReport report = new ValidationReport(color && !cmd.hasOption("no-color"));
      if (format.equals("json")) {
        out.println(report.toJson(results));
      } else {
        out.print(report.toText(results));
      }
    } catch (IOException | TemplateException exc) {
      out.println(String.format("validation failed: %s", exc.getMessage()));
      return EXIT_USAGE;
    }
    return results.isAllValid() ? EXIT_VALID : EXIT_INVALID;
  }

  /**
   * Run validation, colouring output when attached to a terminal
   *
   * @param args Command line arguments
   * @param out Report stream
   * @return Exit status
   */
  public static int run(String[] args, PrintStream out) {
    return run(args, out, System.console() != null);
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }
}
