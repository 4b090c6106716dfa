package com.anthem.acctctl.core.ctl;

import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes control records as {@code "<version>#" + base64(json)}.
 */
public final class CtlCodec {

    /** The only defined record format. */
    public static final int VERSION = 1;

    private static final String PREFIX = VERSION + "#";

    private CtlCodec() {
    }

    public static String encode(Ctl ctl) {
        byte[] json = JsonUtils.toJson(ctl).getBytes(StandardCharsets.UTF_8);
        return PREFIX + Base64.getEncoder().encodeToString(json);
    }

    /**
     * Decodes a record. A null or empty string decodes to {@link Ctl#EMPTY}.
     *
     * @throws AcctCtlException of kind CTL_FORMAT if the version is unknown or
     *                          the payload is malformed
     */
    public static Ctl decode(String s) {
        if (s == null || s.isEmpty()) {
            return Ctl.EMPTY;
        }
        String b64 = s;
        int ver = 0;
        int i = s.indexOf('#');
        if (i > 0) {
            try {
                ver = Integer.parseInt(s.substring(0, i));
                b64 = s.substring(i + 1);
            } catch (NumberFormatException e) {
                ver = 0;
            }
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new AcctCtlException(ErrorKind.CTL_FORMAT, "invalid account control encoding", e);
        }
        if (ver != VERSION) {
            throw new AcctCtlException(ErrorKind.CTL_FORMAT,
                    "invalid account control version (" + ver + ")");
        }
        try {
            return JsonUtils.fromJson(new String(json, StandardCharsets.UTF_8), Ctl.class);
        } catch (JsonProcessingException e) {
            throw new AcctCtlException(ErrorKind.CTL_FORMAT, "invalid account control data", e);
        }
    }
}
