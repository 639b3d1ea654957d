package com.verlumen.forecastbench.app;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.ArgumentType;

/** Parses {@code yes/true/t/y/1} and {@code no/false/f/n/0}, ignoring case. */
final class BooleanArgumentType implements ArgumentType<Boolean> {
  private static final ImmutableSet<String> TRUE_VALUES =
      ImmutableSet.of("yes", "true", "t", "y", "1");
  private static final ImmutableSet<String> FALSE_VALUES =
      ImmutableSet.of("no", "false", "f", "n", "0");

  @Override
  public Boolean convert(ArgumentParser parser, Argument arg, String value)
      throws ArgumentParserException {
    String normalized = Ascii.toLowerCase(value.trim());
    if (TRUE_VALUES.contains(normalized)) {
      return true;
    }
    if (FALSE_VALUES.contains(normalized)) {
      return false;
    }
    throw new ArgumentParserException(
        String.format("argument %s: boolean value expected, got '%s'", arg.textualName(), value),
        parser);
  }
}
