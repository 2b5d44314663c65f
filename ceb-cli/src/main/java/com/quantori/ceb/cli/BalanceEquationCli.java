package com.quantori.ceb.cli;

import com.quantori.ceb.api.exception.BalancingException;
import com.quantori.ceb.api.model.BalancedEquation;
import com.quantori.ceb.api.service.EquationBalancer;
import com.quantori.ceb.core.configuration.BalancerConfiguration;
import com.quantori.ceb.core.format.EquationFormatter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line entry point: {@code -i P4O10 H2O -o H3PO4} prints {@code P4O10 + 6H2O --> 4H3PO4}.
 */
@Slf4j
public class BalanceEquationCli {

  public static final int EXIT_OK = 0;
  public static final int EXIT_UNBALANCEABLE = 1;
  public static final int EXIT_USAGE = 2;

  private static final String OPTION_INPUT = "i";
  private static final String OPTION_OUTPUT = "o";
  private static final String OPTION_HELP = "h";

  private final EquationBalancer balancer;
  private final PrintStream out;
  private final PrintStream err;

  public BalanceEquationCli(EquationBalancer balancer, PrintStream out, PrintStream err) {
    this.balancer = balancer;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    var cli = new BalanceEquationCli(BalancerConfiguration.equationBalancer(), System.out, System.err);
    System.exit(cli.run(args));
  }

  static Options options() {
    var opts = new Options();
    opts.addOption(Option.builder(OPTION_INPUT).longOpt("input-molecules").hasArgs().argName("formula")
        .desc("Reactant formulas, e.g. P4O10 H2O").build());
    opts.addOption(Option.builder(OPTION_OUTPUT).longOpt("output-molecules").hasArgs().argName("formula")
        .desc("Product formulas, e.g. H3PO4").build());
    opts.addOption(Option.builder(OPTION_HELP).longOpt("help").desc("Print this help message and exit").build());
    return opts;
  }

  /**
   * Parses arguments, balances the equation and prints it.
   *
   * @param args command line arguments
   * @return process exit code
   */
  public int run(String[] args) {
    Options opts = options();
    CommandLineParser cmdLineParser = new DefaultParser();
    CommandLine cmdLine;
    try {
      cmdLine = cmdLineParser.parse(opts, args);
    } catch (ParseException e) {
      err.println("Caught exception when parsing command line: " + e.getMessage());
      printHelp(opts);
      return EXIT_USAGE;
    }

    if (cmdLine.hasOption(OPTION_HELP)) {
      printHelp(opts);
      return EXIT_OK;
    }
    if (!cmdLine.hasOption(OPTION_INPUT) || !cmdLine.hasOption(OPTION_OUTPUT)) {
      err.println("Both input and output molecules are required");
      printHelp(opts);
      return EXIT_USAGE;
    }

    List<String> inputs = Arrays.asList(cmdLine.getOptionValues(OPTION_INPUT));
    List<String> outputs = Arrays.asList(cmdLine.getOptionValues(OPTION_OUTPUT));
    try {
      BalancedEquation balanced = balancer.balance(inputs, outputs);
      out.println(EquationFormatter.format(inputs, outputs, balanced));
      return EXIT_OK;
    } catch (BalancingException e) {
      log.debug("Balancing failed", e);
      err.println(e.getMessage());
      return EXIT_UNBALANCEABLE;
    }
  }

  private void printHelp(Options opts) {
    var writer = new PrintWriter(err);
    new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "ceb -i <formula>... -o <formula>...",
        null, opts, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    writer.flush();
  }
}
