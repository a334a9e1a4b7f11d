package io.chatstream.client;

import java.io.InputStream;

/**
 * HTTP seam of the client. Implementations send one request and hand back the response body
 * as an unread stream; the caller closes it.
 */
public interface ChatStreamTransport {
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
