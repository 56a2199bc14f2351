package io.github.joke.mismatch.diagnostic;

import static java.util.Collections.emptyList;

import io.github.joke.mismatch.fix.CandidateFix;
import java.util.List;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/** A diagnostic reduced to what a presentation layer shows. */
@Value
public class PreparedAnnotation {
    Severity severity;
    @Nullable ErrorCode errorCode;
    String header;
    String description;
    List<CandidateFix> fixes;

    public static PreparedAnnotation error(ErrorCode errorCode, String header) {
        return new PreparedAnnotation(Severity.ERROR, errorCode, header, "", emptyList());
    }

    /** Header followed by the error code in brackets, e.g. {@code mismatched types [E0308]}. */
    public String simpleHeader() {
        return errorCode == null ? header : header + " [" + errorCode.code() + "]";
    }

    /** Tooltip HTML with the error code linked to its explanation. */
    public String fullDescription() {
        String escapedHeader = escape(header);
        String htmlHeader = errorCode == null
                ? escapedHeader
                : escapedHeader + " [<a href='" + errorCode.infoUrl() + "'>" + errorCode.code() + "</a>]";
        return "<html>" + htmlHeader + "<br>" + escape(description) + "</html>";
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#39;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
