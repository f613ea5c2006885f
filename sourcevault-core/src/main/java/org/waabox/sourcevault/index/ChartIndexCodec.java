package org.waabox.sourcevault.index;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import org.waabox.sourcevault.ContentException;

/**
 * Static utility that parses chart repository {@code index.yaml} files.
 *
 * <p>Uses Jackson's tree model over the YAML data format, reading only the
 * fields needed to select and verify a chart package: {@code name},
 * {@code version}, {@code created}, {@code digest} and {@code urls}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChartIndexCodec {

  /** Shared mapper for tree model operations. */
  private static final YAMLMapper MAPPER = new YAMLMapper();

  private ChartIndexCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses an index.
   *
   * @param data the raw index bytes, never null
   * @return the parsed index, never null, possibly empty
   *
   * @throws ContentException if the bytes are not a YAML mapping
   */
  public static ChartIndex parse(final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(data);
    } catch (final IOException e) {
      throw new ContentException(
          "failed to parse repository index: " + e.getMessage(), e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      return new ChartIndex(Map.of());
    }
    if (!root.isObject()) {
      throw new ContentException(
          "failed to parse repository index: not a YAML mapping");
    }

    final Map<String, List<ChartVersion>> entries = new LinkedHashMap<>();
    final JsonNode entriesNode = root.path("entries");
    final Iterator<Map.Entry<String, JsonNode>> charts =
        entriesNode.fields();
    while (charts.hasNext()) {
      final Map.Entry<String, JsonNode> chart = charts.next();
      final List<ChartVersion> versions = new ArrayList<>();
      int position = 0;
      for (final JsonNode node : chart.getValue()) {
        final String version = text(node, "version");
        if (version == null) {
          continue;
        }
        final String name = text(node, "name");
        versions.add(new ChartVersion(
            name == null ? chart.getKey() : name,
            version,
            instant(text(node, "created")),
            text(node, "digest"),
            urls(node.path("urls")),
            position++));
      }
      entries.put(chart.getKey(), versions);
    }
    return new ChartIndex(entries);
  }

  /** Returns the text of a scalar field, null if missing or blank.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the text or null.
   */
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    final String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  /** Reads the url list.
   *
   * @param node the urls node.
   * @return the urls, never null.
   */
  private static List<String> urls(final JsonNode node) {
    final List<String> urls = new ArrayList<>();
    for (final JsonNode url : node) {
      if (url.isValueNode() && !url.asText().isBlank()) {
        urls.add(url.asText().trim());
      }
    }
    return urls;
  }

  /** Parses an RFC 3339 timestamp, null when absent or invalid.
   *
   * @param value the timestamp text.
   * @return the instant or null.
   */
  private static Instant instant(final String value) {
    if (value == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (final DateTimeParseException e) {
      return null;
    }
  }
}
