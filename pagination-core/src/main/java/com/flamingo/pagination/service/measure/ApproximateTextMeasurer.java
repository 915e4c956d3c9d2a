package com.flamingo.pagination.service.measure;

import com.flamingo.pagination.config.PaginationConfig;
import com.flamingo.pagination.domain.block.BlockAttrs;
import com.flamingo.pagination.domain.block.DrawingBlock;
import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.block.ImageBlock;
import com.flamingo.pagination.domain.block.ParagraphBlock;
import com.flamingo.pagination.domain.block.TextRun;
import com.flamingo.pagination.domain.measure.BoxMeasure;
import com.flamingo.pagination.domain.measure.LineMeasure;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.measure.MeasureConstraints;
import com.flamingo.pagination.domain.measure.ParagraphMeasure;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link MeasurementPort} that estimates text metrics from font sizes alone.
 *
 * <p>Every character advances by {@code fontSize * charWidthFactor}; lines break greedily after
 * whitespace, and a word wider than the line is split between characters. A line is as tall as its
 * largest font times {@code lineHeightFactor}. Images and drawings use their {@code width} and
 * {@code height} properties.
 *
 * <p>Active unless {@code pagination.measurement.strategy} names another port.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "pagination.measurement.strategy",
    havingValue = "approximate",
    matchIfMissing = true)
public class ApproximateTextMeasurer implements MeasurementPort {

  private static final double DEFAULT_FONT_SIZE = 12.0;

  private final PaginationConfig paginationConfig;

  @Override
  public CompletableFuture<Measure> measure(FlowBlock block, MeasureConstraints constraints) {
    Measure measure =
        switch (block.kind()) {
          case PARAGRAPH -> measureParagraph((ParagraphBlock) block, constraints);
          case IMAGE -> measureBox(((ImageBlock) block).attrs(), constraints);
          case DRAWING -> measureBox(((DrawingBlock) block).attrs(), constraints);
          default ->
              throw new IllegalArgumentException(
                  "Breaks are not measured: " + block.id() + " (" + block.kind() + ")");
        };
    return CompletableFuture.completedFuture(measure);
  }

  private BoxMeasure measureBox(BlockAttrs attrs, MeasureConstraints constraints) {
    PaginationConfig.Measurement settings = paginationConfig.getMeasurement();
    double width = attrs.numberProperty("width", constraints.maxWidth());
    double height = attrs.numberProperty("height", settings.getDefaultBoxHeight());
    return new BoxMeasure(Math.min(width, constraints.maxWidth()), height);
  }

  private ParagraphMeasure measureParagraph(
      ParagraphBlock paragraph, MeasureConstraints constraints) {
    PaginationConfig.Measurement settings = paginationConfig.getMeasurement();
    List<TextRun> runs = paragraph.runs();
    CharTable chars = CharTable.of(runs, settings.getCharWidthFactor());

    if (chars.size() == 0) {
      double fontSize = runs.isEmpty() ? DEFAULT_FONT_SIZE : runs.get(0).fontSize();
      double lineHeight = fontSize * settings.getLineHeightFactor();
      int lastRun = Math.max(0, runs.size() - 1);
      return ParagraphMeasure.of(
          List.of(
              new LineMeasure(
                  0, 0, lastRun, 0, 0, lineHeight * 0.8, lineHeight * 0.2, lineHeight)));
    }

    List<LineMeasure> lines = new ArrayList<>();
    double maxWidth = constraints.maxWidth();
    int lineStart = 0;
    while (lineStart < chars.size()) {
      int lineEnd = lineStart;
      double lineWidth = 0;
      int lastBreak = -1;
      double widthAtBreak = 0;
      while (lineEnd < chars.size()) {
        double advance = chars.width[lineEnd];
        if (lineWidth + advance > maxWidth && lineEnd > lineStart) {
          break;
        }
        lineWidth += advance;
        lineEnd++;
        if (Character.isWhitespace(chars.ch[lineEnd - 1])) {
          lastBreak = lineEnd;
          widthAtBreak = lineWidth;
        }
      }
      if (lineEnd < chars.size() && lastBreak > lineStart) {
        lineEnd = lastBreak;
        lineWidth = widthAtBreak;
      }
      lines.add(chars.line(lineStart, lineEnd, lineWidth, settings.getLineHeightFactor()));
      lineStart = lineEnd;
    }
    log.trace("Measured paragraph {} into {} lines", paragraph.id(), lines.size());
    return ParagraphMeasure.of(lines);
  }

  /** Flattened per-character view of a paragraph's runs. */
  private static final class CharTable {
    private final char[] ch;
    private final double[] width;
    private final double[] font;
    private final int[] run;
    private final int[] offset;
    private final List<TextRun> runs;

    private CharTable(int size, List<TextRun> runs) {
      this.ch = new char[size];
      this.width = new double[size];
      this.font = new double[size];
      this.run = new int[size];
      this.offset = new int[size];
      this.runs = runs;
    }

    static CharTable of(List<TextRun> runs, double charWidthFactor) {
      int size = runs.stream().mapToInt(r -> r.text().length()).sum();
      CharTable table = new CharTable(size, runs);
      int i = 0;
      for (int r = 0; r < runs.size(); r++) {
        TextRun textRun = runs.get(r);
        String text = textRun.text();
        for (int c = 0; c < text.length(); c++, i++) {
          table.ch[i] = text.charAt(c);
          table.width[i] = textRun.fontSize() * charWidthFactor;
          table.font[i] = textRun.fontSize();
          table.run[i] = r;
          table.offset[i] = c;
        }
      }
      return table;
    }

    int size() {
      return ch.length;
    }

    LineMeasure line(int start, int end, double lineWidth, double lineHeightFactor) {
      double maxFont = 0;
      for (int i = start; i < end; i++) {
        maxFont = Math.max(maxFont, font[i]);
      }
      double lineHeight = maxFont * lineHeightFactor;
      int toRun;
      int toChar;
      if (end < ch.length) {
        toRun = run[end];
        toChar = offset[end];
      } else {
        toRun = runs.size() - 1;
        toChar = runs.get(toRun).text().length();
      }
      return new LineMeasure(
          run[start],
          offset[start],
          toRun,
          toChar,
          lineWidth,
          lineHeight * 0.8,
          lineHeight * 0.2,
          lineHeight);
    }
  }
}
