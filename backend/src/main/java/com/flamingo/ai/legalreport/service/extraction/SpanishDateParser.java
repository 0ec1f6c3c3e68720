package com.flamingo.ai.legalreport.service.extraction;

import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds dates in Chilean legal text: numeric ({@code 12-03-2020}, {@code 12/03/2020}), ISO ({@code
 * 2020-03-12}), and written ({@code 12 de marzo de 2020}, {@code doce de marzo del año dos mil
 * veinte}). Dates are returned in order of first appearance without duplicates.
 */
@Component
public class SpanishDateParser {

  private static final int MIN_YEAR = 1900;
  private static final int MAX_YEAR = 2100;

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("enero", 1),
          Map.entry("febrero", 2),
          Map.entry("marzo", 3),
          Map.entry("abril", 4),
          Map.entry("mayo", 5),
          Map.entry("junio", 6),
          Map.entry("julio", 7),
          Map.entry("agosto", 8),
          Map.entry("septiembre", 9),
          Map.entry("setiembre", 9),
          Map.entry("octubre", 10),
          Map.entry("noviembre", 11),
          Map.entry("diciembre", 12));

  private static final Map<String, Integer> NUMBER_WORDS =
      Map.ofEntries(
          Map.entry("un", 1),
          Map.entry("uno", 1),
          Map.entry("primero", 1),
          Map.entry("dos", 2),
          Map.entry("tres", 3),
          Map.entry("cuatro", 4),
          Map.entry("cinco", 5),
          Map.entry("seis", 6),
          Map.entry("siete", 7),
          Map.entry("ocho", 8),
          Map.entry("nueve", 9),
          Map.entry("diez", 10),
          Map.entry("once", 11),
          Map.entry("doce", 12),
          Map.entry("trece", 13),
          Map.entry("catorce", 14),
          Map.entry("quince", 15),
          Map.entry("dieciseis", 16),
          Map.entry("diecisiete", 17),
          Map.entry("dieciocho", 18),
          Map.entry("diecinueve", 19),
          Map.entry("veinte", 20),
          Map.entry("veintiun", 21),
          Map.entry("veintiuno", 21),
          Map.entry("veintidos", 22),
          Map.entry("veintitres", 23),
          Map.entry("veinticuatro", 24),
          Map.entry("veinticinco", 25),
          Map.entry("veintiseis", 26),
          Map.entry("veintisiete", 27),
          Map.entry("veintiocho", 28),
          Map.entry("veintinueve", 29),
          Map.entry("treinta", 30),
          Map.entry("cuarenta", 40),
          Map.entry("cincuenta", 50),
          Map.entry("sesenta", 60),
          Map.entry("setenta", 70),
          Map.entry("ochenta", 80),
          Map.entry("noventa", 90));

  private static final String MONTH_ALTERNATION = String.join("|", MONTHS.keySet());

  private static final Pattern NUMERIC =
      Pattern.compile("\\b(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})\\b");
  private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
  private static final Pattern WRITTEN =
      Pattern.compile(
          "\\b(\\d{1,2}|[a-z]+(?: y [a-z]+)?) de ("
              + MONTH_ALTERNATION
              + ")(?: de| del)?(?: ano)? (\\d{4}|(?:dos mil|mil novecientos)(?: [a-z]+(?: y"
              + " [a-z]+)?)?)");

  public List<LocalDate> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String normalized = TextNormalizer.normalize(text);
    List<Match> matches = new ArrayList<>();

    Matcher numeric = NUMERIC.matcher(normalized);
    while (numeric.find()) {
      toDate(
              Integer.parseInt(numeric.group(3)),
              Integer.parseInt(numeric.group(2)),
              Integer.parseInt(numeric.group(1)))
          .ifPresent(d -> matches.add(new Match(numeric.start(), d)));
    }

    Matcher iso = ISO.matcher(normalized);
    while (iso.find()) {
      toDate(
              Integer.parseInt(iso.group(1)),
              Integer.parseInt(iso.group(2)),
              Integer.parseInt(iso.group(3)))
          .ifPresent(d -> matches.add(new Match(iso.start(), d)));
    }

    Matcher written = WRITTEN.matcher(normalized);
    while (written.find()) {
      OptionalInt day = parseNumber(written.group(1));
      OptionalInt year = parseYear(written.group(3));
      if (day.isPresent() && year.isPresent()) {
        toDate(year.getAsInt(), MONTHS.get(written.group(2)), day.getAsInt())
            .ifPresent(d -> matches.add(new Match(written.start(), d)));
      }
    }

    matches.sort(Comparator.comparingInt(Match::position));
    LinkedHashSet<LocalDate> ordered = new LinkedHashSet<>();
    matches.forEach(m -> ordered.add(m.date()));
    return List.copyOf(ordered);
  }

  /** Parses "12", "doce", "treinta y uno". */
  OptionalInt parseNumber(String words) {
    String trimmed = words.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return OptionalInt.of(Integer.parseInt(trimmed));
    }
    int total = 0;
    for (String part : trimmed.split(" y ")) {
      Integer value = NUMBER_WORDS.get(part.trim());
      if (value == null) {
        return OptionalInt.empty();
      }
      total += value;
    }
    return OptionalInt.of(total);
  }

  /** Parses "2020", "dos mil veinte", "mil novecientos noventa y nueve". */
  OptionalInt parseYear(String words) {
    String trimmed = words.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return OptionalInt.of(Integer.parseInt(trimmed));
    }
    int base;
    String rest;
    if (trimmed.startsWith("dos mil")) {
      base = 2000;
      rest = trimmed.substring("dos mil".length());
    } else if (trimmed.startsWith("mil novecientos")) {
      base = 1900;
      rest = trimmed.substring("mil novecientos".length());
    } else {
      return OptionalInt.empty();
    }
    if (rest.isBlank()) {
      return OptionalInt.of(base);
    }
    // trailing word that is not a number belongs to the next sentence
    OptionalInt remainder = parseNumber(rest);
    return OptionalInt.of(base + remainder.orElse(0));
  }

  private static Optional<LocalDate> toDate(int year, int month, int day) {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private record Match(int position, LocalDate date) {}
}
