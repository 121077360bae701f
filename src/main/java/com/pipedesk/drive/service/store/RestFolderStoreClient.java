package com.pipedesk.drive.service.store;

import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.exception.StoreWriteOutcomeUnknownException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.store.CreateFolderRequest;
import com.pipedesk.drive.model.store.RenameItemRequest;
import com.pipedesk.drive.model.store.StoreErrorInfo;
import com.pipedesk.drive.model.store.StoreItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.Collections;
import java.util.List;

/**
 * Document store adapter speaking JSON over HTTP. Connect and read timeouts are set on the
 * underlying {@link RestClient}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "pipedesk.drive.store.mode", havingValue = "remote")
public class RestFolderStoreClient implements FolderStoreClient {

    private static final ParameterizedTypeReference<List<StoreItem>> ITEM_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    @Autowired
    public RestFolderStoreClient(@Qualifier("folderStoreRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public StoreItem createFolder(String name, String parentId) {
        if (StringUtils.isAnyBlank(name, parentId)) {
            throw new ValidationException("createFolder failed. name or parentId is blank. " +
                    "name is %s, parentId is %s".formatted(name, parentId));
        }
        return this.write(
                "createFolder(%s, %s)".formatted(name, parentId),
                () -> this.restClient.post()
                        .uri("/folders")
                        .body(new CreateFolderRequest(name, parentId))
                        .exchange((request, response) -> this.readBody(
                                response.getStatusCode(),
                                () -> response.bodyTo(StoreItem.class),
                                () -> response.bodyTo(StoreErrorInfo.class),
                                false))
        );
    }

    @Override
    public List<StoreItem> listChildren(String folderId) {
        if (StringUtils.isBlank(folderId)) {
            throw new ValidationException("listChildren failed. folderId is blank");
        }
        List<StoreItem> result = this.read(
                "listChildren(%s)".formatted(folderId),
                () -> this.restClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/folders/{folderId}/children").build(folderId))
                        .exchange((request, response) -> this.readBody(
                                response.getStatusCode(),
                                () -> response.bodyTo(ITEM_LIST),
                                () -> response.bodyTo(StoreErrorInfo.class),
                                false))
        );
        if (ObjectUtils.isEmpty(result)) {
            return Collections.emptyList();
        }
        // trashed items are still listed by the store, for the engine they do not exist
        return result.stream().filter(item -> !item.isTrashed()).toList();
    }

    @Override
    public StoreItem createFile(byte[] content, String name, String mimeType, String parentId) {
        if (ObjectUtils.isEmpty(content) || StringUtils.isAnyBlank(name, parentId)) {
            throw new ValidationException("createFile failed. content, name or parentId is empty. " +
                    "name is %s, parentId is %s".formatted(name, parentId));
        }
        MediaType contentType = StringUtils.isBlank(mimeType) ?
                MediaType.APPLICATION_OCTET_STREAM :
                MediaType.parseMediaType(mimeType);
        return this.write(
                "createFile(%s, %s)".formatted(name, parentId),
                () -> this.restClient.post()
                        .uri(uriBuilder -> uriBuilder.path("/folders/{parentId}/files")
                                .queryParam("name", name)
                                .build(parentId))
                        .contentType(contentType)
                        .body(content)
                        .exchange((request, response) -> this.readBody(
                                response.getStatusCode(),
                                () -> response.bodyTo(StoreItem.class),
                                () -> response.bodyTo(StoreErrorInfo.class),
                                false))
        );
    }

    @Override
    public StoreItem getItem(String itemId) {
        if (StringUtils.isBlank(itemId)) {
            throw new ValidationException("getItem failed. itemId is blank");
        }
        return this.read(
                "getItem(%s)".formatted(itemId),
                () -> this.restClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/items/{itemId}").build(itemId))
                        .exchange((request, response) -> this.readBody(
                                response.getStatusCode(),
                                () -> response.bodyTo(StoreItem.class),
                                () -> response.bodyTo(StoreErrorInfo.class),
                                true))
        );
    }

    @Override
    public StoreItem renameItem(String itemId, String newName) {
        if (StringUtils.isAnyBlank(itemId, newName)) {
            throw new ValidationException("renameItem failed. itemId or newName is blank");
        }
        return this.write(
                "renameItem(%s, %s)".formatted(itemId, newName),
                () -> this.restClient.patch()
                        .uri(uriBuilder -> uriBuilder.path("/items/{itemId}").build(itemId))
                        .body(new RenameItemRequest(newName))
                        .exchange((request, response) -> this.readBody(
                                response.getStatusCode(),
                                () -> response.bodyTo(StoreItem.class),
                                () -> response.bodyTo(StoreErrorInfo.class),
                                false))
        );
    }

    // a failed read changes nothing, the caller may simply ask again
    private <T> T read(String operation, StoreCall<T> call) {
        try {
            return call.execute();
        } catch (ResourceAccessException e) {
            throw new StoreUnavailableException("%s failed. store unreachable or timed out".formatted(operation), e);
        }
    }

    // a failed write may still have happened on the store side
    private <T> T write(String operation, StoreCall<T> call) {
        T result;
        try {
            result = call.execute();
        } catch (ResourceAccessException e) {
            log.warn("{} outcome unknown. the item may have been created.", operation, e);
            throw new StoreWriteOutcomeUnknownException(
                    "%s failed. store unreachable or timed out, outcome unknown".formatted(operation), e);
        }
        if (ObjectUtils.isEmpty(result)) {
            throw new StoreUnavailableException("%s failed. store answered without a body".formatted(operation));
        }
        return result;
    }

    private <T> T readBody(
            HttpStatusCode statusCode,
            StoreCall<T> successBody,
            StoreCall<StoreErrorInfo> errorBody,
            boolean notFoundAsNull) {
        if (statusCode.is2xxSuccessful()) {
            return successBody.execute();
        }
        if (notFoundAsNull && statusCode.value() == HttpStatus.NOT_FOUND.value()) {
            return null;
        }
        StoreErrorInfo errorInfo = null;
        try {
            errorInfo = errorBody.execute();
        } catch (RuntimeException e) {
            log.debug("store error body unreadable. status is {}", statusCode.value(), e);
        }
        throw new StoreUnavailableException("store answered with http code %s. ErrorInfo is %s"
                .formatted(statusCode.value(), errorInfo));
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T execute();
    }
}
