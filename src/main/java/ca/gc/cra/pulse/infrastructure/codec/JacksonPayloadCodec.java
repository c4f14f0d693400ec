package ca.gc.cra.pulse.infrastructure.codec;

import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.port.PayloadCodec;
import ca.gc.cra.pulse.domain.error.DecodeException;
import ca.gc.cra.pulse.domain.error.EncodingException;
import ca.gc.cra.pulse.domain.repr.Attr;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.CollectorRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.Location;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.NodeKind;
import ca.gc.cra.pulse.domain.repr.NodeRepr;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.Representation;
import ca.gc.cra.pulse.domain.repr.Section;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.repr.UnrepresentableRepr;
import ca.gc.cra.pulse.domain.repr.WarningRepr;
import ca.gc.cra.pulse.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Payload codec that writes tagged JSON with the Jackson streaming API and
 * carries it as lower-case hexadecimal.
 * <p><strong>Why:</strong> Hex tokens contain no whitespace or newlines, so one argument never breaks
 * the line framing.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link PayloadCodec} for both sides of the pipe.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map engine objects through {@link RepresentationMapper}; degrade unknown kinds to
 *       {@link UnrepresentableRepr} placeholders.</li>
 *   <li>Locate the first non-hex character of a corrupt token for diagnostics.</li>
 *   <li>Capture the run root path from decoded configurations and bind decoded node ids to it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Encoding is stateless apart from metrics and safe for concurrent
 * use; the captured root path is published through an {@link AtomicReference}.</p>
 * <p><strong>Observability:</strong> Increments {@code emit.encode.placeholder} for each placeholder.</p>
 *
 * @since 0.1.0
 */
public final class JacksonPayloadCodec implements PayloadCodec {
  private static final Logger log = LoggerFactory.getLogger(JacksonPayloadCodec.class);
  private static final HexFormat HEX = HexFormat.of();
  private static final int PLACEHOLDER_TEXT_BYTES = 200;

  static final String TAG = "@t";
  static final String T_NODE_ID = "nodeid";
  static final String T_CONFIG = "config";
  static final String T_SESSION = "session";
  static final String T_ITEM = "item";
  static final String T_COLLECTOR = "collector";
  static final String T_COLLECT_REPORT = "collect_report";
  static final String T_TEST_REPORT = "test_report";
  static final String T_WARNING = "warning";
  static final String T_UNREPRESENTABLE = "unrepresentable";

  private final JsonFactory factory = new JsonFactory();
  private final RepresentationMapper mapper = new RepresentationMapper();
  private final AtomicReference<Path> rootPath = new AtomicReference<>();
  private final MetricsPort metrics;

  /** Creates a codec without metrics. */
  public JacksonPayloadCodec() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a codec.
   *
   * @param metrics metrics sink for placeholder counts
   */
  public JacksonPayloadCodec(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String encode(Object value) {
    Object normalized = normalize(value);
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, normalized);
    } catch (IOException ex) {
      throw new UncheckedIOException("In-memory JSON generation failed", ex);
    }
    return HEX.formatHex(out.toByteArray());
  }

  @Override
  public Object decode(String token) throws DecodeException {
    Objects.requireNonNull(token, "token");
    byte[] bytes = unhex(token);
    try (JsonParser parser = factory.createParser(bytes)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        throw new DecodeException("Empty payload", token, 0, null);
      }
      Object tree = readValue(parser, first);
      if (parser.nextToken() != null) {
        throw new DecodeException("Payload contains trailing content", token, -1, null);
      }
      return toDomain(tree);
    } catch (JsonProcessingException ex) {
      long byteOffset = ex.getLocation() == null ? -1 : ex.getLocation().getByteOffset();
      int offset = byteOffset < 0 ? -1 : (int) Math.min(token.length(), byteOffset * 2);
      throw new DecodeException("Malformed payload: " + ex.getOriginalMessage(), token, offset, ex);
    } catch (IOException ex) {
      throw new DecodeException("Unreadable payload", token, -1, ex);
    } catch (IllegalArgumentException | ClassCastException ex) {
      throw new DecodeException("Invalid payload structure: " + ex.getMessage(), token, -1, ex);
    }
  }

  @Override
  public Optional<Path> rootPath() {
    return Optional.ofNullable(rootPath.get());
  }

  private Object normalize(Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Boolean
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Double
        || value instanceof NodeId
        || value instanceof Representation) {
      return value;
    }
    if (value instanceof Short || value instanceof Byte) {
      return ((Number) value).intValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value instanceof Character || value instanceof Enum<?>) {
      return value.toString();
    }
    if (value instanceof Iterable<?> iterable) {
      List<Object> list = new ArrayList<>();
      for (Object element : iterable) {
        list.add(normalize(element));
      }
      return list;
    }
    if (value instanceof Object[] array) {
      List<Object> list = new ArrayList<>(array.length);
      for (Object element : array) {
        list.add(normalize(element));
      }
      return list;
    }
    try {
      return mapper.map(value);
    } catch (EncodingException ex) {
      log.warn("{}; sending placeholder", ex.getMessage());
      metrics.increment("emit.encode.placeholder");
      return new UnrepresentableRepr(
          ex.typeName(), Logs.truncate(String.valueOf(value), PLACEHOLDER_TEXT_BYTES));
    }
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String s) {
      gen.writeString(s);
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer i) {
      gen.writeNumber(i);
    } else if (value instanceof Long l) {
      gen.writeNumber(l);
    } else if (value instanceof Double d) {
      gen.writeNumber(d);
    } else if (value instanceof NodeId id) {
      gen.writeStartObject();
      gen.writeStringField(TAG, T_NODE_ID);
      gen.writeStringField("v", id.value());
      gen.writeEndObject();
    } else if (value instanceof List<?> list) {
      gen.writeStartArray();
      for (Object element : list) {
        writeValue(gen, element);
      }
      gen.writeEndArray();
    } else if (value instanceof Representation repr) {
      writeRepresentation(gen, repr);
    } else {
      throw new IllegalStateException("Unnormalized value " + value.getClass().getName());
    }
  }

  private void writeRepresentation(JsonGenerator gen, Representation repr) throws IOException {
    gen.writeStartObject();
    if (repr instanceof ConfigRepr config) {
      gen.writeStringField(TAG, T_CONFIG);
      gen.writeStringField("rootPath", config.rootPath().toString());
      gen.writeObjectFieldStart("options");
      for (Map.Entry<String, Attr<String>> option : config.options().entrySet()) {
        writeAttr(gen, option.getKey(), option.getValue());
      }
      gen.writeEndObject();
      gen.writeArrayFieldStart("plugins");
      for (String plugin : config.pluginNames()) {
        gen.writeString(plugin);
      }
      gen.writeEndArray();
    } else if (repr instanceof SessionRepr session) {
      gen.writeStringField(TAG, T_SESSION);
      writeAttr(gen, "config", session.config());
    } else if (repr instanceof ItemRepr item) {
      gen.writeStringField(TAG, T_ITEM);
      gen.writeStringField("nodeid", item.nodeId().value());
      gen.writeStringField("name", item.name());
      gen.writeStringField("kind", item.kind().wireName());
      writeAttr(gen, "path", item.path());
      writeAttr(gen, "originalName", item.originalName());
      if (item.parentId().isPresent()) {
        gen.writeStringField("parent", item.parentId().value().value());
      }
    } else if (repr instanceof CollectorRepr collector) {
      gen.writeStringField(TAG, T_COLLECTOR);
      gen.writeStringField("nodeid", collector.nodeId().value());
      gen.writeStringField("name", collector.name());
      gen.writeStringField("kind", collector.kind().wireName());
      writeAttr(gen, "path", collector.path());
    } else if (repr instanceof CollectReportRepr report) {
      gen.writeStringField(TAG, T_COLLECT_REPORT);
      gen.writeStringField("nodeid", report.nodeId().value());
      gen.writeStringField("outcome", report.outcome().wireName());
      gen.writeStringField("when", report.when());
      gen.writeArrayFieldStart("result");
      for (NodeRepr node : report.result()) {
        writeRepresentation(gen, node);
      }
      gen.writeEndArray();
      writeSections(gen, report.sections());
      writeAttr(gen, "longrepr", report.longRepr());
    } else if (repr instanceof TestReportRepr report) {
      gen.writeStringField(TAG, T_TEST_REPORT);
      gen.writeStringField("nodeid", report.nodeId().value());
      gen.writeStringField("when", report.when().wireName());
      gen.writeStringField("outcome", report.outcome().wireName());
      gen.writeNumberField("duration", report.duration());
      gen.writeNumberField("start", report.start());
      gen.writeNumberField("stop", report.stop());
      writeAttr(gen, "location", report.location());
      writeSections(gen, report.sections());
      writeAttr(gen, "longrepr", report.longRepr());
      writeAttr(gen, "wasxfail", report.wasXfail());
      writeAttr(gen, "workerId", report.workerId());
    } else if (repr instanceof WarningRepr warning) {
      gen.writeStringField(TAG, T_WARNING);
      gen.writeStringField("message", warning.message());
      gen.writeStringField("category", warning.category());
      gen.writeStringField("when", warning.when());
      gen.writeStringField("nodeid", warning.nodeId());
      writeAttr(gen, "filename", warning.filename());
      writeAttr(gen, "lineno", warning.lineNumber());
      writeAttr(gen, "function", warning.function());
    } else if (repr instanceof UnrepresentableRepr placeholder) {
      gen.writeStringField(TAG, T_UNREPRESENTABLE);
      gen.writeStringField("type", placeholder.typeName());
      gen.writeStringField("text", placeholder.text());
    }
    gen.writeEndObject();
  }

  private void writeSections(JsonGenerator gen, List<Section> sections) throws IOException {
    gen.writeArrayFieldStart("sections");
    for (Section section : sections) {
      gen.writeStartArray();
      gen.writeString(section.title());
      gen.writeString(section.content());
      gen.writeEndArray();
    }
    gen.writeEndArray();
  }

  private void writeAttr(JsonGenerator gen, String field, Attr<?> attr) throws IOException {
    switch (attr.state()) {
      case ABSENT -> {
        // omitted
      }
      case UNREPRESENTABLE -> {
        gen.writeObjectFieldStart(field);
        gen.writeStringField(TAG, T_UNREPRESENTABLE);
        gen.writeStringField("type", attr.typeName());
        gen.writeEndObject();
      }
      case PRESENT -> {
        gen.writeFieldName(field);
        Object value = attr.value();
        if (value instanceof Location location) {
          gen.writeStartObject();
          gen.writeStringField("path", location.path());
          gen.writeNumberField("line", location.line());
          gen.writeStringField("domain", location.domain());
          gen.writeEndObject();
        } else {
          writeValue(gen, value);
        }
      }
      default -> throw new IllegalStateException("Unexpected attribute state " + attr.state());
    }
  }

  private static byte[] unhex(String token) throws DecodeException {
    for (int i = 0; i < token.length(); i++) {
      if (Character.digit(token.charAt(i), 16) < 0) {
        throw new DecodeException("Non-hex encoded data", token, i, null);
      }
    }
    if ((token.length() & 1) != 0) {
      throw new DecodeException("Odd-length hex payload", token, token.length(), null);
    }
    return HEX.parseHex(token);
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private Object toDomain(Object tree) {
    if (tree instanceof List<?> list) {
      List<Object> converted = new ArrayList<>(list.size());
      for (Object element : list) {
        converted.add(toDomain(element));
      }
      return converted;
    }
    if (tree instanceof Map<?, ?> map) {
      return toRepresentation(map);
    }
    if (tree instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
      return l.intValue();
    }
    return tree;
  }

  private Object toRepresentation(Map<?, ?> map) {
    String tag = string(map, TAG);
    return switch (tag) {
      case T_NODE_ID -> nodeId(string(map, "v"));
      case T_CONFIG -> config(map);
      case T_SESSION -> new SessionRepr(attr(map, "config", v -> (ConfigRepr) toRepresentation((Map<?, ?>) v)));
      case T_ITEM, T_COLLECTOR -> node(map);
      case T_COLLECT_REPORT -> collectReport(map);
      case T_TEST_REPORT -> testReport(map);
      case T_WARNING -> new WarningRepr(
          string(map, "message"),
          string(map, "category"),
          string(map, "when"),
          string(map, "nodeid"),
          attr(map, "filename", String.class::cast),
          attr(map, "lineno", v -> ((Number) v).intValue()),
          attr(map, "function", String.class::cast));
      case T_UNREPRESENTABLE -> new UnrepresentableRepr(string(map, "type"), optString(map, "text"));
      default -> throw new IllegalArgumentException("Unknown representation tag: " + tag);
    };
  }

  private ConfigRepr config(Map<?, ?> map) {
    Path root = Path.of(string(map, "rootPath"));
    Map<String, Attr<String>> options = new LinkedHashMap<>();
    Object rawOptions = map.get("options");
    if (rawOptions instanceof Map<?, ?> optionMap) {
      for (Object key : optionMap.keySet()) {
        options.put(String.valueOf(key), attr(optionMap, String.valueOf(key), v -> String.valueOf(v)));
      }
    }
    List<String> plugins = new ArrayList<>();
    if (map.get("plugins") instanceof List<?> list) {
      for (Object plugin : list) {
        plugins.add(String.valueOf(plugin));
      }
    }
    rootPath.set(root);
    log.debug("Captured run root path {}", root);
    return new ConfigRepr(root, options, plugins);
  }

  private NodeRepr node(Map<?, ?> map) {
    NodeId id = nodeId(string(map, "nodeid"));
    boolean item = T_ITEM.equals(map.get(TAG));
    NodeKind kind = NodeKind.fromWire(optString(map, "kind"), item);
    Attr<String> path = attr(map, "path", String.class::cast);
    if (!item) {
      return new CollectorRepr(id, optString(map, "name"), path, kind);
    }
    return new ItemRepr(
        id,
        optString(map, "name"),
        path,
        attr(map, "originalName", String.class::cast),
        attr(map, "parent", v -> nodeId((String) v)),
        kind);
  }

  private CollectReportRepr collectReport(Map<?, ?> map) {
    List<NodeRepr> result = new ArrayList<>();
    if (map.get("result") instanceof List<?> list) {
      for (Object element : list) {
        result.add((NodeRepr) toRepresentation((Map<?, ?>) element));
      }
    }
    return new CollectReportRepr(
        nodeId(string(map, "nodeid")),
        ReportOutcome.fromWire(string(map, "outcome")),
        optString(map, "when"),
        result,
        sections(map),
        attr(map, "longrepr", String.class::cast));
  }

  private TestReportRepr testReport(Map<?, ?> map) {
    return new TestReportRepr(
        nodeId(string(map, "nodeid")),
        Phase.fromWire(string(map, "when")),
        ReportOutcome.fromWire(string(map, "outcome")),
        number(map, "duration"),
        number(map, "start"),
        number(map, "stop"),
        attr(map, "location", JacksonPayloadCodec::location),
        sections(map),
        attr(map, "longrepr", String.class::cast),
        attr(map, "wasxfail", String.class::cast),
        attr(map, "workerId", String.class::cast));
  }

  private static Location location(Object value) {
    Map<?, ?> map = (Map<?, ?>) value;
    Object line = map.get("line");
    return new Location(
        string(map, "path"),
        line instanceof Number n ? n.intValue() : Location.UNKNOWN_LINE,
        optString(map, "domain"));
  }

  private static List<Section> sections(Map<?, ?> map) {
    List<Section> sections = new ArrayList<>();
    if (map.get("sections") instanceof List<?> list) {
      for (Object element : list) {
        List<?> pair = (List<?>) element;
        sections.add(new Section(String.valueOf(pair.get(0)), String.valueOf(pair.get(1))));
      }
    }
    return sections;
  }

  private NodeId nodeId(String value) {
    return NodeId.of(value, rootPath.get());
  }

  private static <T> Attr<T> attr(
      Map<?, ?> map, String field, Function<Object, T> converter) {
    if (!map.containsKey(field)) {
      return Attr.absent();
    }
    Object value = map.get(field);
    if (value == null) {
      return Attr.absent();
    }
    if (value instanceof Map<?, ?> nested && T_UNREPRESENTABLE.equals(nested.get(TAG))) {
      return Attr.unrepresentable(optString(nested, "type"));
    }
    return Attr.present(converter.apply(value));
  }

  private static String string(Map<?, ?> map, String field) {
    Object value = map.get(field);
    if (!(value instanceof String s)) {
      throw new IllegalArgumentException("Missing string field '" + field + "'");
    }
    return s;
  }

  private static String optString(Map<?, ?> map, String field) {
    Object value = map.get(field);
    return value == null ? null : value.toString();
  }

  private static double number(Map<?, ?> map, String field) {
    Object value = map.get(field);
    return value instanceof Number n ? n.doubleValue() : 0d;
  }
}
