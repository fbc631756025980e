package com.jstubhttp.components.services;

import com.jstubhttp.components.exceptions.ReadException;
import com.jstubhttp.components.infra.Connection;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RequestReaderTest {
    private final RequestReader requestReader = new RequestReader(1024);

    private static Connection connection(InputStream in) {
        return new Connection(null, in, new ByteArrayOutputStream());
    }

    @Test
    public void testReadsRequestBytes() throws ReadException {
        byte[] request = "GET /health HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
        RawRequest raw = requestReader.read(connection(new ByteArrayInputStream(request)));

        assertArrayEquals(request, raw.getData());
    }

    @Test
    public void testReadIsBoundedByBufferSize() throws ReadException {
        byte[] large = new byte[4096];
        Arrays.fill(large, (byte) 'a');
        RawRequest raw = requestReader.read(connection(new ByteArrayInputStream(large)));

        assertEquals(1024, raw.length());
    }

    @Test
    public void testEndOfStreamGivesEmptyRequest() throws ReadException {
        RawRequest raw = requestReader.read(connection(new ByteArrayInputStream(new byte[0])));

        assertTrue(raw.isEmpty());
    }

    @Test
    public void testReadFailureIsWrapped() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("Connection reset");
            }
        };

        ReadException e = assertThrows(ReadException.class, () -> requestReader.read(connection(failing)));
        assertTrue(e.getMessage().contains("Connection reset"));
    }

    @Test
    public void testBufferSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RequestReader(0));
    }
}
