package com.jstubhttp.components.services;

import com.jstubhttp.components.exceptions.MalformedRequestException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Splits the first line of a raw request into method, target and version.
 */
@Component
public class RequestLineTokenizer {

    public HttpRequest tokenize(RawRequest rawRequest) throws MalformedRequestException {
        if (rawRequest.isEmpty()) {
            return HttpRequest.EMPTY;
        }
        String data = new String(rawRequest.getData(), StandardCharsets.ISO_8859_1);
        String line = firstLine(data);
        if (line.isEmpty()) {
            throw new MalformedRequestException("Empty request line");
        }

        String[] parts = line.split(" ", -1);
        if (parts.length < 2 || parts.length > 3 || parts[0].isEmpty() || !parts[1].startsWith("/")) {
            throw new MalformedRequestException("Malformed request line: " + line);
        }
        // the version may be missing when the first read stops short of it
        String version = parts.length == 3 ? parts[2] : "";
        if (parts.length == 3 && !version.startsWith("HTTP/")) {
            throw new MalformedRequestException("Unsupported protocol version: " + version);
        }

        return new HttpRequest(parts[0], parts[1], pathOf(parts[1]), version);
    }

    static String pathOf(String target) {
        int end = target.length();
        int query = target.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = target.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return target.substring(0, end);
    }

    private String firstLine(String data) {
        int lf = data.indexOf('\n');
        String line = lf >= 0 ? data.substring(0, lf) : data;
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }
}
