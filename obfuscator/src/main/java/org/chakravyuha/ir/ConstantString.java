package org.chakravyuha.ir;

import org.chakravyuha.ir.type.ArrayType;
import org.chakravyuha.ir.type.IntegerType;

import java.nio.charset.StandardCharsets;

/**
 * {@code [N x i8]} initializer, printed as {@code c"..."}.
 */
public final class ConstantString extends Constant {

    private final byte[] data;

    public ConstantString(byte[] data) {
        super(new ArrayType(IntegerType.I8, data.length));
        this.data = data.clone();
    }

    public static ConstantString ofCString(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        byte[] withNul = new byte[bytes.length + 1];
        System.arraycopy(bytes, 0, withNul, 0, bytes.length);
        return new ConstantString(withNul);
    }

    @Override
    public ArrayType getType() {
        return (ArrayType) super.getType();
    }

    public byte[] getData() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    /**
     * @return true if the data is NUL-terminated and holds no other NUL byte
     */
    public boolean isCString() {
        if (data.length == 0 || data[data.length - 1] != 0) {
            return false;
        }
        for (int i = 0; i < data.length - 1; i++) {
            if (data[i] == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the text without its trailing NUL, decoded as UTF-8
     */
    public String getAsString() {
        int len = isCString() ? data.length - 1 : data.length;
        return new String(data, 0, len, StandardCharsets.UTF_8);
    }

    @Override
    public String getReference() {
        StringBuilder sb = new StringBuilder("c\"");
        for (byte b : data) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append('\\').append(String.format("%02X", c));
            }
        }
        return sb.append('"').toString();
    }
}
