package com.pipedesk.drive.util;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.api.hierarchy.EntityRefRequest;
import com.pipedesk.drive.model.api.hierarchy.RetireMappingRequest;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

public class EntityValidationUtil {

    public static void isEntityRefRequestValid(EntityRefRequest entityRefRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(entityRefRequest)) {
            throw new ValidationException("isEntityRefRequestValid failed. entityRefRequest is null");
        }
        entityRefRequest.setEntityTypeInner(
                parseEntityType(entityRefRequest.getEntityType(), entityRefRequest.getEntityId()));
    }

    public static void isRetireMappingRequestValid(
            RetireMappingRequest retireMappingRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(retireMappingRequest)) {
            throw new ValidationException("isRetireMappingRequestValid failed. retireMappingRequest is null");
        }
        if (StringUtils.isAnyBlank(retireMappingRequest.getDeletedBy(), retireMappingRequest.getReason())) {
            throw new ValidationException("isRetireMappingRequestValid failed. deletedBy: %s or reason: %s is blank"
                    .formatted(retireMappingRequest.getDeletedBy(), retireMappingRequest.getReason()));
        }
        retireMappingRequest.setEntityTypeInner(
                parseEntityType(retireMappingRequest.getEntityType(), retireMappingRequest.getEntityId()));
    }

    // only company, lead and deal are addressable from outside
    public static EntityTypeEnum parseEntityType(String entityType, String entityId) throws ValidationException {
        if (StringUtils.isAnyBlank(entityType, entityId)) {
            throw new ValidationException("parseEntityType failed. entityType: %s or entityId: %s is blank"
                    .formatted(entityType, entityId));
        }
        EntityTypeEnum entityTypeEnum = EntityTypeEnum.fromCode(entityType);
        if (ObjectUtils.isEmpty(entityTypeEnum) || !entityTypeEnum.isBusinessEntity()) {
            throw new ValidationException("parseEntityType failed. entityType %s is not supported"
                    .formatted(entityType));
        }
        return entityTypeEnum;
    }
}
