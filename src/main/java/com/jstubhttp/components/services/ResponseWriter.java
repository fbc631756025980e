package com.jstubhttp.components.services;

import com.jstubhttp.components.exceptions.WriteException;
import com.jstubhttp.components.infra.Connection;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Component
public class ResponseWriter {

    public byte[] serialize(HttpResponse response) {
        StringBuilder sb = new StringBuilder();
        sb.append("HTTP/1.1 ").append(response.getStatus()).append(" ").append(response.getReason()).append("\r\n");
        for (Map.Entry<String, String> header : response.getHeaders().entrySet()) {
            sb.append(header.getKey()).append(": ").append(header.getValue()).append("\r\n");
        }
        sb.append("\r\n");

        byte[] head = sb.toString().getBytes(StandardCharsets.US_ASCII);
        byte[] body = response.bodyBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length + body.length);
        out.writeBytes(head);
        out.writeBytes(body);
        return out.toByteArray();
    }

    /**
     * Single blocking write; a short write is not retried.
     */
    public void write(Connection connection, HttpResponse response) throws WriteException {
        try {
            OutputStream outputStream = connection.getOutputStream();
            outputStream.write(serialize(response));
            outputStream.flush();
        } catch (IOException e) {
            throw new WriteException(connection.getId(), e);
        }
    }
}
