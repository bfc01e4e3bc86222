package org.abstractica.cloudsession.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.cloudsession.RoomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Encodes and decodes wire protocol packets to/from newline-delimited JSON.
 *
 * <p>Each packet is one JSON object terminated by {@code \n}. A single
 * inbound frame may carry several packets; each line is decoded on its own
 * so one malformed line does not spoil the rest of the frame.</p>
 */
public final class PacketCodec
{
    private static final Logger LOG = LoggerFactory.getLogger(PacketCodec.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    static final String FIELD_METHOD = "method";
    static final String FIELD_USER = "user";
    static final String FIELD_PROJECT_ID = "project_id";
    static final String FIELD_NAME = "name";
    static final String FIELD_VALUE = "value";

    private PacketCodec() {}

    /**
     * Result of decoding a frame.
     *
     * @param packets           well-formed packets, in frame order
     * @param malformedSegments number of non-empty lines that were dropped
     */
    public record DecodeResult(
            List<Packet> packets,
            int malformedSegments
    )
    {
        public DecodeResult
        {
            packets = List.copyOf(packets);
        }
    }

    // ========== Encoding ==========

    /**
     * Encodes a packet as a single newline-terminated JSON line.
     *
     * @param packet the packet to encode
     * @return the wire text
     */
    public static String encode(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");

        ObjectNode root = MAPPER.createObjectNode();
        root.put(FIELD_METHOD, packet.method().getWireName());
        if (packet.user() != null)
        {
            root.put(FIELD_USER, packet.user());
        }
        if (packet.roomId() != null)
        {
            putRoomId(root, packet.roomId());
        }
        if (packet instanceof SetVariable set)
        {
            root.put(FIELD_NAME, set.name());
            root.put(FIELD_VALUE, set.value());
        }
        return root.toString() + "\n";
    }

    private static void putRoomId(ObjectNode root, RoomId roomId)
    {
        if (roomId.numeric())
        {
            root.put(FIELD_PROJECT_ID, roomId.asLong());
        }
        else
        {
            root.put(FIELD_PROJECT_ID, roomId.value());
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes every packet in a frame.
     *
     * <p>Blank lines are skipped. Lines that are not valid packets are
     * dropped and counted.</p>
     *
     * @param frame the raw frame text
     * @return the decoded packets and the number of dropped lines
     */
    public static DecodeResult decode(String frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.isEmpty())
        {
            return new DecodeResult(Collections.emptyList(), 0);
        }

        List<Packet> packets = new ArrayList<>();
        int malformed = 0;

        for (String segment : frame.split("\n"))
        {
            if (segment.isBlank())
            {
                continue;
            }
            try
            {
                packets.add(decodeSegment(segment));
            }
            catch (PacketDecodingException e)
            {
                malformed++;
                LOG.debug("Dropping malformed segment: {}", e.getMessage());
            }
        }

        return new DecodeResult(packets, malformed);
    }

    /**
     * Decodes a single JSON line.
     *
     * @param segment one line of a frame, without the newline
     * @return the packet
     * @throws PacketDecodingException if the line is not a valid packet
     */
    public static Packet decodeSegment(String segment)
    {
        JsonNode root;
        try
        {
            root = MAPPER.readTree(segment);
        }
        catch (JsonProcessingException e)
        {
            throw new PacketDecodingException("Invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject())
        {
            throw new PacketDecodingException("Packet is not a JSON object");
        }

        JsonNode methodNode = root.get(FIELD_METHOD);
        if (methodNode == null || !methodNode.isTextual())
        {
            throw new PacketDecodingException("Packet has no method");
        }

        PacketMethod method = PacketMethod.fromWireName(methodNode.asText());
        String user = optionalText(root, FIELD_USER);
        RoomId roomId = optionalRoomId(root);

        return switch (method)
        {
            case HANDSHAKE -> new Handshake(user, roomId);
            case SET -> new SetVariable(user, roomId, requiredText(root, FIELD_NAME), requiredValue(root));
        };
    }

    private static String optionalText(JsonNode root, String field)
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull())
        {
            return null;
        }
        if (!node.isValueNode())
        {
            throw new PacketDecodingException("Field '" + field + "' is not a scalar");
        }
        return node.asText();
    }

    private static String requiredText(JsonNode root, String field)
    {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual())
        {
            throw new PacketDecodingException("Field '" + field + "' is missing or not a string");
        }
        return node.asText();
    }

    private static String requiredValue(JsonNode root)
    {
        JsonNode node = root.get(FIELD_VALUE);
        if (node == null || !(node.isTextual() || node.isNumber()))
        {
            throw new PacketDecodingException("Field 'value' is missing or not a string or number");
        }
        if (node.isNumber())
        {
            // 1e3 and 1000.0 both read back as "1000".
            return node.decimalValue().stripTrailingZeros().toPlainString();
        }
        return node.asText();
    }

    private static RoomId optionalRoomId(JsonNode root)
    {
        JsonNode node = root.get(FIELD_PROJECT_ID);
        if (node == null || node.isNull())
        {
            return null;
        }
        if (node.canConvertToLong() && node.isIntegralNumber())
        {
            return RoomId.of(node.asLong());
        }
        if (node.isTextual() && !node.asText().isEmpty())
        {
            return RoomId.of(node.asText());
        }
        throw new PacketDecodingException("Field 'project_id' is not a valid room id");
    }
}
