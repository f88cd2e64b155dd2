package org.muma.simple.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.simple.redis.config.SimpleRedisConfig;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * RESP 编解码核心逻辑，不依赖 Channel，可以直接对内存中的 ByteBuf 使用。
 * <p>
 * 解码是可重入的：数据不够一帧时返回 {@link DecodeResult#INCOMPLETE}，读指针保持不变，
 * 调用方补充数据后重试即可。格式错误时抛出 {@link RespProtocolException}，读指针同样复位。
 * <p>
 * 实例本身只持有各项上限，线程安全。
 */
public final class RespCodec {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 32;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_INLINE_LENGTH = 64 * 1024;

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';
    private static final byte HASH_BYTE = '#';
    private static final byte COMMA_BYTE = ',';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    private static final Pattern DOUBLE_LITERAL =
            Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final int maxNestingDepth;
    private final int maxBulkLength;
    private final int maxArrayLength;
    private final int maxInlineLength;

    public RespCodec() {
        this(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH, DEFAULT_MAX_INLINE_LENGTH);
    }

    public RespCodec(int maxNestingDepth, int maxBulkLength, int maxArrayLength, int maxInlineLength) {
        if (maxNestingDepth < 1 || maxBulkLength < 0 || maxArrayLength < 0 || maxInlineLength < 1) {
            throw new IllegalArgumentException("Invalid RESP codec limits");
        }
        this.maxNestingDepth = maxNestingDepth;
        this.maxBulkLength = maxBulkLength;
        this.maxArrayLength = maxArrayLength;
        this.maxInlineLength = maxInlineLength;
    }

    public static RespCodec fromConfig(SimpleRedisConfig config) {
        return new RespCodec(config.getMaxNestingDepth(), config.getMaxBulkLength(),
                config.getMaxArrayLength(), config.getMaxInlineLength());
    }

    // ------------------------------------------------------------------
    // 编码
    // ------------------------------------------------------------------

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            encode(msg, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    public static void encode(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            writeLine(out, PLUS_BYTE, s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, MINUS_BYTE, e.content());
        } else if (msg instanceof RedisInteger i) {
            writeLine(out, COLON_BYTE, String.valueOf(i.value()));
        } else if (msg instanceof RedisBoolean b) {
            writeLine(out, HASH_BYTE, b.value() ? "t" : "f");
        } else if (msg instanceof RedisDouble d) {
            writeLine(out, COMMA_BYTE, formatDouble(d.value()));
        } else if (msg instanceof BulkString b) {
            out.writeByte(DOLLAR_BYTE);
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                out.writeCharSequence(String.valueOf(b.content().length), StandardCharsets.US_ASCII);
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte(ASTERISK_BYTE);
            if (a.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                out.writeCharSequence(String.valueOf(a.elements().length), StandardCharsets.US_ASCII);
                out.writeBytes(CRLF);
                for (RedisMessage element : a.elements()) {
                    encode(element, out);
                }
            }
        }
    }

    private static void writeLine(ByteBuf out, byte type, String content) {
        out.writeByte(type);
        out.writeCharSequence(content, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    /**
     * + 和 - 帧只能有一行，内容里的 CR / LF 换成空格，否则一条回复会在线路上变成两帧
     */
    public static String singleLine(String text) {
        if (text == null || (text.indexOf(CR) < 0 && text.indexOf(LF) < 0)) {
            return text;
        }
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    static String formatDouble(double value) {
        if (Double.isNaN(value)) return "nan";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        return Double.toString(value).replace('E', 'e');
    }

    // ------------------------------------------------------------------
    // 解码
    // ------------------------------------------------------------------

    public DecodeResult decode(byte[] bytes) {
        return decode(Unpooled.wrappedBuffer(bytes));
    }

    /**
     * 从 in 的读指针处尝试解出一帧。成功时读指针前移 consumed 个字节。
     */
    public DecodeResult decode(ByteBuf in) {
        int start = in.readerIndex();
        RedisMessage msg;
        try {
            msg = readMessage(in, start, 0);
        } catch (RespProtocolException e) {
            in.readerIndex(start);
            throw e;
        }
        if (msg == null) {
            in.readerIndex(start);
            return DecodeResult.INCOMPLETE;
        }
        return new DecodeResult.Complete(msg, in.readerIndex() - start);
    }

    // 返回 null 表示数据不够
    private RedisMessage readMessage(ByteBuf in, int origin, int depth) {
        if (!in.isReadable()) return null;

        int typePos = in.readerIndex();
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> {
                String line = readLine(in, origin);
                yield line == null ? null : new SimpleString(line);
            }
            case MINUS_BYTE -> {
                String line = readLine(in, origin);
                yield line == null ? null : new ErrorMessage(line);
            }
            case COLON_BYTE -> {
                Long value = readLong(in, origin);
                yield value == null ? null : new RedisInteger(value);
            }
            case HASH_BYTE -> readBoolean(in, origin);
            case COMMA_BYTE -> readDouble(in, origin);
            case DOLLAR_BYTE -> readBulkString(in, origin);
            case ASTERISK_BYTE -> readArray(in, origin, depth);
            default -> throw new RespProtocolException(
                    "Unknown RESP type byte '" + printable(type) + "'", typePos - origin);
        };
    }

    // $<length>\r\n<data>\r\n
    private RedisMessage readBulkString(ByteBuf in, int origin) {
        int lengthPos = in.readerIndex();
        Long length = readLong(in, origin);
        if (length == null) return null;
        if (length == -1) return BulkString.NULL;
        if (length < -1) {
            throw new RespProtocolException("Invalid bulk length " + length, lengthPos - origin);
        }
        if (length > maxBulkLength) {
            throw new RespProtocolException("Bulk length " + length + " exceeds limit " + maxBulkLength,
                    lengthPos - origin);
        }

        int len = length.intValue();
        if (in.readableBytes() < (long) len + CRLF.length) return null;

        byte[] content = new byte[len];
        in.readBytes(content);

        int crlfPos = in.readerIndex();
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new RespProtocolException("Expected CRLF after bulk data", crlfPos - origin);
        }
        return new BulkString(content);
    }

    // *<count>\r\n<element1>...<elementN>
    private RedisMessage readArray(ByteBuf in, int origin, int depth) {
        int countPos = in.readerIndex();
        if (depth + 1 > maxNestingDepth) {
            throw new RespProtocolException("Array nesting exceeds limit " + maxNestingDepth, countPos - 1 - origin);
        }

        Long count = readLong(in, origin);
        if (count == null) return null;
        if (count == -1) return RedisArray.NULL;
        if (count < -1) {
            throw new RespProtocolException("Invalid multibulk length " + count, countPos - origin);
        }
        if (count > maxArrayLength) {
            throw new RespProtocolException("Multibulk length " + count + " exceeds limit " + maxArrayLength,
                    countPos - origin);
        }

        RedisMessage[] elements = new RedisMessage[count.intValue()];
        for (int i = 0; i < elements.length; i++) {
            RedisMessage element = readMessage(in, origin, depth + 1);
            if (element == null) return null;
            elements[i] = element;
        }
        return new RedisArray(elements);
    }

    private RedisMessage readBoolean(ByteBuf in, int origin) {
        int linePos = in.readerIndex();
        String line = readLine(in, origin);
        if (line == null) return null;
        return switch (line) {
            case "t" -> new RedisBoolean(true);
            case "f" -> new RedisBoolean(false);
            default -> throw new RespProtocolException("Invalid boolean '" + line + "'", linePos - origin);
        };
    }

    private RedisMessage readDouble(ByteBuf in, int origin) {
        int linePos = in.readerIndex();
        String line = readLine(in, origin);
        if (line == null) return null;
        return switch (line) {
            case "inf", "+inf" -> new RedisDouble(Double.POSITIVE_INFINITY);
            case "-inf" -> new RedisDouble(Double.NEGATIVE_INFINITY);
            case "nan" -> new RedisDouble(Double.NaN);
            default -> {
                if (!DOUBLE_LITERAL.matcher(line).matches()) {
                    throw new RespProtocolException("Invalid double '" + line + "'", linePos - origin);
                }
                yield new RedisDouble(Double.parseDouble(line));
            }
        };
    }

    // 读取并解析长整型，只接受可选负号加十进制数字
    private Long readLong(ByteBuf in, int origin) {
        int linePos = in.readerIndex();
        String line = readLine(in, origin);
        if (line == null) return null;

        int digitsFrom = line.startsWith("-") ? 1 : 0;
        boolean valid = line.length() > digitsFrom;
        for (int i = digitsFrom; valid && i < line.length(); i++) {
            char c = line.charAt(i);
            valid = c >= '0' && c <= '9';
        }
        if (!valid) {
            throw new RespProtocolException("Invalid integer '" + line + "'", linePos - origin);
        }
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Integer out of range '" + line + "'", linePos - origin);
        }
    }

    // 读取一行（不含 \r\n）。行尾还没到齐时返回 null
    private String readLine(ByteBuf in, int origin) {
        int from = in.readerIndex();
        int searchEnd = (int) Math.min(in.writerIndex(), (long) from + maxInlineLength + 1);
        int cr = in.indexOf(from, searchEnd, CR);
        if (cr < 0) {
            if (in.writerIndex() - from > maxInlineLength) {
                throw new RespProtocolException("Line exceeds limit " + maxInlineLength, from - origin);
            }
            return null;
        }
        if (cr + 1 >= in.writerIndex()) return null;
        if (in.getByte(cr + 1) != LF) {
            throw new RespProtocolException("Expected LF after CR", cr + 1 - origin);
        }

        String line = in.toString(from, cr - from, StandardCharsets.UTF_8);
        in.readerIndex(cr + CRLF.length);
        return line;
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b);
    }
}
