package co.fanki.blueprintmcp.parsing.domain;

import co.fanki.blueprintmcp.shared.DomainException;
import co.fanki.blueprintmcp.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code Begin Object ... End Object} text dump into a forest
 * of {@link RawObject}s.
 *
 * <p>The parser is line based and never aborts on malformed content: a
 * header it cannot read becomes a placeholder object holding the raw
 * line, a stray {@code End Object} is ignored, and blocks still open at
 * the end of the text are closed implicitly. Values spanning several
 * lines are joined until their parentheses balance.</p>
 *
 * <p>Instances are stateless and safe to share.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RawObjectParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            RawObjectParser.class);

    private static final char BOM = '\uFEFF';

    /** Pin children created from CustomProperties lines use this class. */
    public static final String PIN_CLASS = "EdGraphPin";

    /** Holds the unreadable header or lines of a block, one per line. */
    public static final String RAW_TEXT_PROPERTY = "RawText";

    // -- Line patterns ---------------------------------------------------

    private static final Pattern BEGIN_WITH_CLASS = Pattern.compile(
            "^Begin Object\\s+Class=(?<cls>\\S+)\\s+Name=\"(?<name>[^\"]*)\""
                    + "(?:\\s+ExportPath=(?<export>.*))?\\s*$");

    private static final Pattern BEGIN_NAME_ONLY = Pattern.compile(
            "^Begin Object\\s+Name=\"(?<name>[^\"]*)\""
                    + "(?:\\s+ExportPath=(?<export>.*))?\\s*$");

    private static final Pattern CUSTOM_PIN = Pattern.compile(
            "^CustomProperties\\s+Pin\\s*(?<body>\\(.*)$", Pattern.DOTALL);

    private static final Pattern PROPERTY = Pattern.compile(
            "^(?<key>[\\w.\\[\\]()]+)=(?<value>.*)$", Pattern.DOTALL);

    /**
     * Parses a text dump.
     *
     * @param text the dump, may start with a byte order mark
     * @return the root objects in text order
     * @throws DomainException when the text is blank
     */
    public List<RawObject> parse(final String text) {
        Preconditions.requireInput(text != null && !text.isBlank(),
                "Blueprint text cannot be empty",
                DomainException.INVALID_INPUT);

        final ParseState state = new ParseState();
        final String[] lines = stripBom(text).split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            state.lineNumber = i + 1;
            state.accept(stripBom(lines[i]).trim());
        }
        state.finish();

        final List<RawObject> roots = new ArrayList<>();
        for (final RawObject.Builder root : state.roots) {
            roots.add(root.build());
        }

        LOG.info("Parsed {} root objects ({} in total) from {} lines",
                roots.size(), RawObject.flatten(roots).size(), lines.length);
        return roots;
    }

    private static String stripBom(final String text) {
        int start = 0;
        while (start < text.length() && text.charAt(start) == BOM) {
            start++;
        }
        return start == 0 ? text : text.substring(start);
    }

    /** The parser's position inside the dump. */
    private static final class ParseState {

        private final List<RawObject.Builder> roots = new ArrayList<>();
        private final Deque<RawObject.Builder> open = new ArrayDeque<>();
        private final Map<String, RawObject.Builder> byName = new HashMap<>();

        private PendingValue pending;
        private int lineNumber;
        private int placeholders;
        private int pinIndex;

        void accept(final String line) {
            if (pending != null) {
                if (isBlockBoundary(line)) {
                    LOG.warn("Line {}: value of '{}' is not closed before"
                            + " the next block boundary", lineNumber,
                            pending.key);
                    flushPending();
                } else {
                    pending.append(line);
                    if (PropertyValueParser.openDepth(pending.text()) == 0) {
                        flushPending();
                    }
                    return;
                }
            }

            if (line.isEmpty() || line.startsWith("//")) {
                return;
            }
            if (line.startsWith("Begin Object")) {
                begin(line);
                return;
            }
            if (line.startsWith("End Object")) {
                end();
                return;
            }
            if (open.isEmpty()) {
                LOG.debug("Line {}: ignoring text outside any object",
                        lineNumber);
                return;
            }
            property(line);
        }

        void finish() {
            if (pending != null) {
                LOG.warn("Value of '{}' is not closed at the end of input",
                        pending.key);
                flushPending();
            }
            if (!open.isEmpty()) {
                LOG.warn("{} object block(s) not closed at the end of input",
                        open.size());
                open.clear();
            }
        }

        private void begin(final String line) {
            final Matcher withClass = BEGIN_WITH_CLASS.matcher(line);
            if (withClass.matches()) {
                final RawObject.Builder builder = new RawObject.Builder(
                        withClass.group("cls"), withClass.group("name"));
                attach(builder);
                return;
            }

            final Matcher nameOnly = BEGIN_NAME_ONLY.matcher(line);
            if (nameOnly.matches()) {
                final String name = nameOnly.group("name");
                final RawObject.Builder existing = findDeclared(name);
                if (existing != null) {
                    open.push(existing);
                } else {
                    attach(new RawObject.Builder("", name));
                }
                return;
            }

            placeholders++;
            LOG.warn("Line {}: malformed object header, keeping it as raw"
                    + " text", lineNumber);
            final RawObject.Builder placeholder = new RawObject.Builder(
                    "", "Malformed_" + placeholders);
            placeholder.property(RAW_TEXT_PROPERTY,
                    new PropertyValue.Scalar(line, line));
            attach(placeholder);
        }

        private void end() {
            if (open.isEmpty()) {
                LOG.warn("Line {}: End Object without a matching Begin"
                        + " Object", lineNumber);
                return;
            }
            open.pop();
        }

        private void property(final String line) {
            final Matcher pin = CUSTOM_PIN.matcher(line);
            if (pin.matches()) {
                startValue(PIN_CLASS, pin.group("body"));
                return;
            }

            final Matcher property = PROPERTY.matcher(line);
            if (property.matches()) {
                startValue(property.group("key"), property.group("value"));
                return;
            }

            LOG.debug("Line {}: unrecognized content in {}", lineNumber,
                    open.peek().name());
            open.peek().appendText(RAW_TEXT_PROPERTY, line);
        }

        private void startValue(final String key, final String value) {
            pending = new PendingValue(open.peek(), key, value);
            if (PropertyValueParser.openDepth(value) == 0) {
                flushPending();
            }
        }

        private void flushPending() {
            final PendingValue value = pending;
            pending = null;
            final PropertyValue parsed = PropertyValueParser.parse(
                    value.text());
            if (PIN_CLASS.equals(value.key)) {
                addPin(value.target, parsed);
            } else {
                value.target.property(value.key, parsed);
            }
        }

        private void addPin(final RawObject.Builder owner,
                final PropertyValue body) {
            pinIndex++;
            final String pinName = body.memberText("PinName");
            final RawObject.Builder pin = new RawObject.Builder(PIN_CLASS,
                    pinName != null ? pinName : "Pin_" + pinIndex);
            if (body instanceof PropertyValue.Struct struct) {
                struct.members().forEach(pin::property);
            } else {
                LOG.warn("Line {}: pin declaration is not a member list",
                        lineNumber);
                pin.property(RAW_TEXT_PROPERTY, body);
            }
            owner.child(pin);
        }

        private void attach(final RawObject.Builder builder) {
            if (open.isEmpty()) {
                roots.add(builder);
            } else {
                open.peek().child(builder);
            }
            byName.putIfAbsent(builder.name(), builder);
            open.push(builder);
        }

        /** Finds a block re-opened by name, preferring the current outer. */
        private RawObject.Builder findDeclared(final String name) {
            final List<RawObject.Builder> siblings = open.isEmpty()
                    ? roots : open.peek().children();
            for (final RawObject.Builder sibling : siblings) {
                if (sibling.name().equals(name)) {
                    return sibling;
                }
            }
            return byName.get(name);
        }

        private static boolean isBlockBoundary(final String line) {
            return line.startsWith("Begin Object")
                    || line.startsWith("End Object");
        }
    }

    /** A property whose value continues on the following lines. */
    private static final class PendingValue {

        private final RawObject.Builder target;
        private final String key;
        private final StringBuilder value;

        PendingValue(final RawObject.Builder theTarget, final String theKey,
                final String theValue) {
            target = theTarget;
            key = theKey;
            value = new StringBuilder(theValue);
        }

        void append(final String line) {
            value.append('\n').append(line);
        }

        String text() {
            return value.toString();
        }
    }

}
