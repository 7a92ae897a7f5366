package io.bdrc.catalogsync.parsing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import io.bdrc.catalogsync.store.BulkItemResult;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class BulkResponseParser {
    private static final JsonFactory jsonFactory = new JsonFactory();

    /**
     * Reads the outcome of every item of a bulk response, in request order.
     *
     * {
        "items": [
            {
                "update": {
                    "_id": "W000001",
                    "result": "noop",
                    "status": 200
                    ...
     *
     * An item carrying an {@code error} object is reported as {@link BulkItemResult.Outcome#ERROR}
     * whatever its status.  A truncated body yields the items that were complete.
     *
     * @param bulkResponse The response body of a {@code _bulk} request
     * @return One result per complete item
     * @throws IOException If the body is not a JSON object
     */
    public static List<BulkItemResult> parseItems(String bulkResponse) throws IOException {
        var results = new ArrayList<BulkItemResult>();
        try (var parser = jsonFactory.createParser(bulkResponse)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected data to start with an Object");
            }

            try {
                while (parser.nextToken() != JsonToken.END_OBJECT) {
                    var fieldName = parser.currentName();
                    parser.nextToken();
                    if ("items".equals(fieldName)) {
                        scanItems(parser, results);
                    } else {
                        parser.skipChildren();
                    }
                }
            } catch (IOException ioe) {
                log.warn("Unable to finish parsing the entire bulk response body", ioe);
            }
        }
        return results;
    }

    private static void scanItems(JsonParser parser, List<BulkItemResult> results) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            throw new IOException("Expected 'items' to be an array");
        }

        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() == JsonToken.START_OBJECT) {
                // Each item is an object with one key (e.g., "update")
                parser.nextToken();
                if (parser.nextToken() == JsonToken.START_OBJECT) {
                    var item = extractItem(parser);
                    log.atDebug().setMessage("Bulk item {} -> {}").addArgument(item::getId)
                        .addArgument(item::getOutcome).log();
                    results.add(item);
                } else {
                    parser.skipChildren();
                }
            } else {
                parser.skipChildren();
            }
        }
    }

    private static BulkItemResult extractItem(JsonParser parser) throws IOException {
        var item = BulkItemResult.builder();
        String result = null;
        boolean hasError = false;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            var innerFieldName = parser.currentName();
            parser.nextToken();

            if ("_id".equals(innerFieldName)) {
                item.id(parser.getText());
            } else if ("result".equals(innerFieldName)) {
                result = parser.getText();
            } else if ("status".equals(innerFieldName)) {
                item.status(parser.getIntValue());
            } else if ("error".equals(innerFieldName)) {
                hasError = true;
                extractError(parser, item);
            } else {
                parser.skipChildren();
            }
        }
        return item.outcome(hasError ? BulkItemResult.Outcome.ERROR : BulkItemResult.Outcome.fromResult(result))
            .build();
    }

    private static void extractError(JsonParser parser, BulkItemResult.BulkItemResultBuilder item) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            item.errorReason(parser.getText());
            parser.skipChildren();
            return;
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            var errorFieldName = parser.currentName();
            parser.nextToken();
            if ("type".equals(errorFieldName)) {
                item.errorType(parser.getText());
            } else if ("reason".equals(errorFieldName)) {
                item.errorReason(parser.getText());
            } else {
                parser.skipChildren();
            }
        }
    }
}
