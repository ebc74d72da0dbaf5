package com.questrail.navigation.protocol.step;

import com.questrail.navigation.api.Move;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * StepCommandCodec
 * -----------------------------------------------------------------------------
 * Wire encoding of the step protocol.
 *
 * <h2>Outbound</h2>
 * Each command is one datagram holding the move's token as UTF-8 text with no
 * delimiter: {@code UP}, {@code DOWN}, {@code LEFT}, {@code RIGHT}, {@code GOAL}.
 *
 * <h2>Inbound</h2>
 * Any non-empty, well-formed UTF-8 datagram is an acknowledgement. The text is
 * returned with surrounding whitespace and double quotes stripped, for
 * display only.
 *
 * <p>The codec is stateless and thread-safe.</p>
 */
public final class StepCommandCodec
{
    public byte[] encode(Move move)
    {
        Objects.requireNonNull(move, "move");
        return move.token().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes a command datagram. Used by controller-side code and tests.
     *
     * @throws StepCodecException if the payload is not a known token
     */
    public Move decodeCommand(byte[] payload)
    {
        String token = decodeText(payload).strip();
        return Move.fromToken(token)
                .orElseThrow(() -> new StepCodecException("Unknown command token '" + token + "'"));
    }

    /**
     * Decodes an acknowledgement datagram.
     *
     * @throws StepCodecException if the payload is empty or not valid UTF-8
     */
    public String decodeAcknowledgement(byte[] payload)
    {
        String text = decodeText(payload);
        return stripQuotes(text.strip());
    }

    private String decodeText(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new StepCodecException("Empty datagram");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            throw new StepCodecException("Datagram is not valid UTF-8", e);
        }
    }

    private static String stripQuotes(String text)
    {
        int begin = text.startsWith("\"") ? 1 : 0;
        int end = text.length() > begin && text.endsWith("\"") ? text.length() - 1 : text.length();
        return text.substring(begin, end);
    }
}
