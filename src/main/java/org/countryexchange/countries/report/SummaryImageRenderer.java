package org.countryexchange.countries.report;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import org.countryexchange.countries.domain.Country;

/**
 * Draws the fixed-layout summary image: white text on an 800x600 black canvas.
 *
 * <p>Coordinates are the top-left corner of each text line, matching the layout below.
 *
 * <pre>
 *   y=30   title, centred, 40px
 *   y=100  Total Countries: N
 *   y=150  Top 5 by GDP:
 *   y=200+60*i  flag at x=50, label at x=100 (y+5)
 *   y=520  Last Updated: yyyy-MM-dd HH:mm:ss UTC
 * </pre>
 */
@Component
public class SummaryImageRenderer {

  static final int WIDTH = 800;
  static final int HEIGHT = 600;

  static final String TITLE = "Country Data Summary";

  private static final DateTimeFormatter LAST_UPDATED_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private static final int TITLE_SIZE = 40;
  private static final int TEXT_SIZE = 24;
  private static final int LEFT_MARGIN = 30;
  private static final int ENTRY_TOP = 200;
  private static final int ENTRY_SPACING = 60;
  private static final int FLAG_X = 50;
  private static final int LABEL_X = 100;
  private static final int LABEL_OFFSET = 5;

  /**
   * Label for one ranked country.
   *
   * @param rank one-based rank
   * @param country the country
   * @return {@code "rank. name - $gdp"}, or {@code "rank. name - N/A"} for unknown GDP
   */
  public static String entryLabel(int rank, Country country) {
    var gdp = country.getEstimatedGdp();
    var value = gdp == null ? GdpFormatter.UNKNOWN : "$" + GdpFormatter.format(gdp);
    return rank + ". " + country.getName() + " - " + value;
  }

  public static String totalLine(long totalCountries) {
    return "Total Countries: " + totalCountries;
  }

  public static String heading(int topCount) {
    return "Top " + topCount + " by GDP:";
  }

  public static String lastUpdatedLine(Instant asOf) {
    return "Last Updated: " + LAST_UPDATED_FORMAT.format(asOf);
  }

  /**
   * Text lines in drawing order, without flags.
   *
   * @param content summary content
   * @return title, total, heading, entry labels, last-updated line
   */
  public List<String> textLines(SummaryContent content) {
    var lines = new ArrayList<String>();
    lines.add(TITLE);
    lines.add(totalLine(content.totalCountries()));
    lines.add(heading(content.topCount()));
    content.entries().forEach(entry -> lines.add(entry.label()));
    lines.add(lastUpdatedLine(content.asOf()));
    return lines;
  }

  /**
   * Renders the summary.
   *
   * @param content summary content
   * @return RGB image of {@value #WIDTH}x{@value #HEIGHT}
   */
  public BufferedImage render(SummaryContent content) {
    var image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    var graphics = image.createGraphics();

    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      graphics.setColor(Color.BLACK);
      graphics.fillRect(0, 0, WIDTH, HEIGHT);
      graphics.setColor(Color.WHITE);

      var titleFont = new Font(Font.SANS_SERIF, Font.PLAIN, TITLE_SIZE);
      var titleWidth = graphics.getFontMetrics(titleFont).stringWidth(TITLE);
      drawText(graphics, titleFont, TITLE, Math.max(0, (WIDTH - titleWidth) / 2), 30);

      var textFont = new Font(Font.SANS_SERIF, Font.PLAIN, TEXT_SIZE);
      drawText(graphics, textFont, totalLine(content.totalCountries()), LEFT_MARGIN, 100);
      drawText(graphics, textFont, heading(content.topCount()), LEFT_MARGIN, 150);

      var entries = content.entries();
      for (var i = 0; i < entries.size(); i++) {
        var entry = entries.get(i);
        var y = ENTRY_TOP + i * ENTRY_SPACING;

        if (entry.flag() != null) {
          graphics.drawImage(entry.flag(), FLAG_X, y, null);
        }
        drawText(graphics, textFont, entry.label(), LABEL_X, y + LABEL_OFFSET);
      }

      drawText(graphics, textFont, lastUpdatedLine(content.asOf()), LEFT_MARGIN, 520);
    } finally {
      graphics.dispose();
    }

    return image;
  }

  // Java2D draws from the baseline, the layout positions the top of the line
  private static void drawText(Graphics2D graphics, Font font, String text, int x, int top) {
    graphics.setFont(font);
    graphics.drawString(text, x, top + graphics.getFontMetrics().getAscent());
  }
}
