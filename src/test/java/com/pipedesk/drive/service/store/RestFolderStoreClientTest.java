package com.pipedesk.drive.service.store;

import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.exception.StoreWriteOutcomeUnknownException;
import com.pipedesk.drive.model.store.StoreItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RestFolderStoreClientTest {

    private static final String BASE_URL = "http://store.test/api";

    private MockRestServiceServer server;

    private RestFolderStoreClient restFolderStoreClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        this.server = MockRestServiceServer.bindTo(builder).build();
        this.restFolderStoreClient = new RestFolderStoreClient(builder.build());
    }

    @Test
    void ShouldCreateFolderFromJsonAnswer() {
        this.server.expect(requestTo(BASE_URL + "/folders"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("02. Deals"))
                .andExpect(jsonPath("$.parentId").value("company-1"))
                .andRespond(withSuccess("""
                        {"id":"f-9","name":"02. Deals","type":"FOLDER","url":"https://drive/f-9",
                         "parents":["company-1"],"unknownField":true}
                        """, MediaType.APPLICATION_JSON));

        StoreItem folder = this.restFolderStoreClient.createFolder("02. Deals", "company-1");

        assertEquals("f-9", folder.getId());
        assertTrue(folder.isFolder());
        assertEquals(List.of("company-1"), folder.getParents());
        this.server.verify();
    }

    @Test
    void ShouldListChildren() {
        this.server.expect(requestTo(BASE_URL + "/folders/p-1/children"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [{"id":"a","name":"A","type":"FOLDER"},{"id":"b","name":"b.pdf","type":"FILE","size":12}]
                        """, MediaType.APPLICATION_JSON));

        List<StoreItem> children = this.restFolderStoreClient.listChildren("p-1");

        assertEquals(2, children.size());
        assertEquals(12L, children.get(1).getSize());
        assertFalse(children.get(1).isFolder());
    }

    @Test
    void ShouldReturnNullWhenItemUnknown() {
        this.server.expect(requestTo(BASE_URL + "/items/missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertNull(this.restFolderStoreClient.getItem("missing"));
    }

    @Test
    void ShouldRaiseUnavailableWhenStoreAnswersWithError() {
        this.server.expect(requestTo(BASE_URL + "/folders/p-1/children"))
                .andRespond(withServerError()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"backend\",\"message\":\"quota\",\"status\":500}"));

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> this.restFolderStoreClient.listChildren("p-1"));
        assertTrue(e.getMessage().contains("500"));
        assertTrue(e.isRetryable());
    }

    @Test
    void ShouldRaiseOutcomeUnknownWhenWriteTimesOut() {
        this.server.expect(requestTo(BASE_URL + "/folders"))
                .andRespond(withException(new SocketTimeoutException("read timed out")));

        assertThrows(StoreWriteOutcomeUnknownException.class,
                () -> this.restFolderStoreClient.createFolder("Deal - X", "p-1"));
    }

    @Test
    void ShouldRaiseUnavailableWhenReadTimesOut() {
        this.server.expect(requestTo(BASE_URL + "/items/i-1"))
                .andRespond(withException(new SocketTimeoutException("read timed out")));

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> this.restFolderStoreClient.getItem("i-1"));
        assertFalse(e instanceof StoreWriteOutcomeUnknownException);
    }

    @Test
    void ShouldDropTrashedChildrenFromListing() {
        this.server.expect(requestTo(BASE_URL + "/folders/p-1/children"))
                .andRespond(withSuccess("""
                        [{"id":"old","name":"02. Deals","type":"FOLDER","trashed":true},
                         {"id":"new","name":"02. Deals","type":"FOLDER","trashed":false}]
                        """, MediaType.APPLICATION_JSON));

        List<StoreItem> children = this.restFolderStoreClient.listChildren("p-1");

        assertEquals(1, children.size());
        assertEquals("new", children.get(0).getId());
    }

    @Test
    void ShouldRaiseUnavailableWhenCreateAnswersWithoutBody() {
        this.server.expect(requestTo(BASE_URL + "/folders"))
                .andRespond(withSuccess());

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> this.restFolderStoreClient.createFolder("02. Deals", "company-1"));
        assertFalse(e instanceof StoreWriteOutcomeUnknownException);
    }
}
