package io.github.yok.mongoclonelink.codec;

import com.google.common.base.Preconditions;
import io.github.yok.mongoclonelink.exception.DocumentDecodeException;
import org.apache.commons.lang3.StringUtils;
import org.bson.BsonDocument;
import org.bson.BsonType;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.DecoderContext;
import org.bson.json.JsonMode;
import org.bson.json.JsonReader;
import org.bson.json.JsonWriterSettings;

/**
 * Converts one document to one line of text and back.
 *
 * <p>
 * The line format is MongoDB Extended JSON v2 in <em>canonical</em> mode. Every value without a
 * native JSON form is wrapped in a reserved-key envelope ({@code $oid}, {@code $date},
 * {@code $numberLong}, {@code $numberDecimal}, {@code $numberDouble}, {@code $binary},
 * {@code $timestamp}, ...), and even 32-bit integers and doubles are tagged, so that
 * {@code decode(encode(d)).equals(d)} holds for every BSON type.
 * </p>
 *
 * <p>
 * Decoding accepts canonical, relaxed and legacy shell/{@code mongoexport} envelopes of the same
 * tag vocabulary, which keeps dumps written by other tools restorable.
 * </p>
 *
 * <p>
 * A line must hold exactly one document. Anything but whitespace after its closing brace makes
 * the line malformed. Blank lines are not handled here; callers skip them before decoding.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ExtendedJsonCodec {

    // Byte-order mark that editors on Windows prepend to UTF-8 files
    private static final String UTF8_BOM = "\uFEFF";

    private static final BsonDocumentCodec DOCUMENT_CODEC = new BsonDocumentCodec();

    private static final DecoderContext DECODER_CONTEXT = DecoderContext.builder().build();

    private static final JsonWriterSettings WRITER_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.EXTENDED).indent(false).build();

    /**
     * Encodes a document as a single line of canonical Extended JSON.
     *
     * @param document document to encode
     * @return encoded line without a trailing line separator
     * @throws NullPointerException if {@code document} is {@code null}
     */
    public String encode(BsonDocument document) {
        Preconditions.checkNotNull(document, "document must not be null");
        return document.toJson(WRITER_SETTINGS);
    }

    /**
     * Decodes one line back into a document.
     *
     * @param line encoded line
     * @return decoded document
     * @throws DocumentDecodeException if the line is not a valid Extended JSON document
     */
    public BsonDocument decode(String line) {
        Preconditions.checkNotNull(line, "line must not be null");
        String text = StringUtils.removeStart(line, UTF8_BOM).trim();
        BsonDocument document;
        BsonType trailing;
        try (JsonReader reader = new JsonReader(text)) {
            document = DOCUMENT_CODEC.decode(reader, DECODER_CONTEXT);
            trailing = reader.readBsonType();
        } catch (RuntimeException e) {
            // JsonParseException, BSONException, and number or ObjectId format errors
            throw new DocumentDecodeException("Malformed document: " + e.getMessage(), e);
        }
        // Only whitespace may follow the document
        if (trailing != BsonType.END_OF_DOCUMENT) {
            throw new DocumentDecodeException(
                    "Malformed document: unexpected " + trailing + " after the closing brace");
        }
        return document;
    }
}
