/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.history.adapter.outbound.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finds message lists inside JSON documents of unknown shape.
 *
 * <p>
 * Recognized envelopes are tried first, in this order:
 * <ul>
 * <li>{@link EnvelopeShape#ROOT_ARRAY} - the document itself is a message
 * array, path {@code root}
 * <li>{@link EnvelopeShape#KNOWN_KEY_ARRAY} - a top-level known key holds
 * messages, path {@code <key>}
 * <li>{@link EnvelopeShape#NESTED_WRAPPER} - a top-level known key holds
 * wrapper objects that each hold a known message array, path
 * {@code <key>[<i>].<inner>}
 * </ul>
 * Only when none of them matches does the locator fall back to a recursive
 * walk over nested objects and arrays of objects, bounded by
 * {@code maxDepth}.
 */
public class MessageListLocator {

    public static final List<String> MESSAGE_KEYS = List.of(
            "messages", "history", "conversations", "tabs", "chats",
            "chat_history", "chatHistory", "data", "items", "entries",
            "bubbles", "exchanges", "turns");

    static final String ROOT_PATH = "root";

    private final int maxDepth;

    public MessageListLocator(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public enum EnvelopeShape {
        ROOT_ARRAY, KNOWN_KEY_ARRAY, NESTED_WRAPPER, DISCOVERED
    }

    /**
     * A message list and the path it was found at.
     */
    public record MessageList(String path, ArrayNode elements, EnvelopeShape shape) {
    }

    public List<MessageList> locate(JsonNode document) {
        if (document == null) {
            return List.of();
        }
        List<MessageList> recognized = matchEnvelope(document);
        if (!recognized.isEmpty()) {
            return recognized;
        }
        List<MessageList> discovered = new ArrayList<>();
        if (document.isArray()) {
            walkElements(document, ROOT_PATH, 0, discovered);
        } else if (document.isObject()) {
            walk(document, "", 0, discovered);
        }
        return discovered;
    }

    private List<MessageList> matchEnvelope(JsonNode document) {
        if (document.isArray()) {
            return containsMessages(document)
                    ? List.of(new MessageList(ROOT_PATH, (ArrayNode) document, EnvelopeShape.ROOT_ARRAY))
                    : List.of();
        }
        if (!document.isObject()) {
            return List.of();
        }

        List<MessageList> direct = new ArrayList<>();
        for (String key : MESSAGE_KEYS) {
            JsonNode value = document.get(key);
            if (value != null && value.isArray() && containsMessages(value)) {
                direct.add(new MessageList(key, (ArrayNode) value, EnvelopeShape.KNOWN_KEY_ARRAY));
            }
        }
        if (!direct.isEmpty()) {
            return direct;
        }

        List<MessageList> wrapped = new ArrayList<>();
        for (String key : MESSAGE_KEYS) {
            JsonNode value = document.get(key);
            if (value == null || !value.isArray()) {
                continue;
            }
            for (int i = 0; i < value.size(); i++) {
                JsonNode wrapper = value.get(i);
                if (!wrapper.isObject()) {
                    continue;
                }
                for (String inner : MESSAGE_KEYS) {
                    JsonNode innerValue = wrapper.get(inner);
                    if (innerValue != null && innerValue.isArray() && containsMessages(innerValue)) {
                        wrapped.add(new MessageList(key + "[" + i + "]." + inner, (ArrayNode) innerValue,
                                EnvelopeShape.NESTED_WRAPPER));
                    }
                }
            }
        }
        return wrapped;
    }

    private void walk(JsonNode node, String prefix, int depth, List<MessageList> sink) {
        if (depth > maxDepth) {
            return;
        }
        for (String key : MESSAGE_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isArray() && containsMessages(value)) {
                sink.add(new MessageList(prefix + key, (ArrayNode) value, EnvelopeShape.DISCOVERED));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (MESSAGE_KEYS.contains(field.getKey()) && value.isArray() && containsMessages(value)) {
                continue;
            }
            if (value.isObject()) {
                walk(value, prefix + field.getKey() + ".", depth + 1, sink);
            } else if (value.isArray()) {
                walkElements(value, prefix + field.getKey(), depth, sink);
            }
        }
    }

    private void walkElements(JsonNode array, String arrayPath, int depth, List<MessageList> sink) {
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (element.isObject()) {
                walk(element, arrayPath + "[" + i + "].", depth + 1, sink);
            }
        }
    }

    private static boolean containsMessages(JsonNode array) {
        for (JsonNode element : array) {
            if (JsonMessageFields.isMessage(element)) {
                return true;
            }
        }
        return false;
    }
}
