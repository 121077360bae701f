package com.pipedesk.drive.service.db.impl;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.ResourceNotFoundException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.mapper.CompanyMapper;
import com.pipedesk.drive.mapper.DealMapper;
import com.pipedesk.drive.mapper.LeadMapper;
import com.pipedesk.drive.model.entity.CompanyEntity;
import com.pipedesk.drive.model.entity.DealEntity;
import com.pipedesk.drive.model.entity.LeadEntity;
import com.pipedesk.drive.model.internal.EntityFolderContext;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Read-only view of the system of record. Soft-deleted rows count as absent.
 */
@Service
public class EntityRecordService {

    static final String LEAD_FOLDER_PREFIX = "Lead - ";

    static final String DEAL_FOLDER_PREFIX = "Deal - ";

    private final CompanyMapper companyMapper;

    private final LeadMapper leadMapper;

    private final DealMapper dealMapper;

    @Autowired
    public EntityRecordService(CompanyMapper companyMapper, LeadMapper leadMapper, DealMapper dealMapper) {
        this.companyMapper = companyMapper;
        this.leadMapper = leadMapper;
        this.dealMapper = dealMapper;
    }

    /**
     * @throws ResourceNotFoundException when the entity does not exist or is deleted
     */
    public EntityFolderContext getFolderContext(EntityTypeEnum entityType, String entityId)
            throws ValidationException, ResourceNotFoundException {
        if (ObjectUtils.isEmpty(entityType) || StringUtils.isBlank(entityId)) {
            throw new ValidationException("getFolderContext failed. entityType or entityId is empty. " +
                    "entityType is %s, entityId is %s".formatted(entityType, entityId));
        }
        return switch (entityType) {
            case COMPANY -> {
                CompanyEntity company = this.companyMapper.selectById(entityId);
                if (ObjectUtils.isEmpty(company) || ObjectUtils.isNotEmpty(company.getDeletedAt())) {
                    throw new ResourceNotFoundException("company %s not found".formatted(entityId));
                }
                yield new EntityFolderContext(entityType, entityId, companyFolderName(company), null);
            }
            case LEAD -> {
                LeadEntity lead = this.leadMapper.selectById(entityId);
                if (ObjectUtils.isEmpty(lead) || ObjectUtils.isNotEmpty(lead.getDeletedAt())) {
                    throw new ResourceNotFoundException("lead %s not found".formatted(entityId));
                }
                yield new EntityFolderContext(
                        entityType,
                        entityId,
                        LEAD_FOLDER_PREFIX + StringUtils.defaultIfBlank(lead.getLegalName(), entityId).trim(),
                        StringUtils.trimToNull(lead.getCompanyId()));
            }
            case DEAL -> {
                DealEntity deal = this.dealMapper.selectById(entityId);
                if (ObjectUtils.isEmpty(deal) || ObjectUtils.isNotEmpty(deal.getDeletedAt())) {
                    throw new ResourceNotFoundException("deal %s not found".formatted(entityId));
                }
                yield new EntityFolderContext(
                        entityType,
                        entityId,
                        DEAL_FOLDER_PREFIX + StringUtils.defaultIfBlank(deal.getTitle(), entityId).trim(),
                        StringUtils.trimToNull(deal.getCompanyId()));
            }
            case SYSTEM_ROOT -> throw new ValidationException(
                    "getFolderContext failed. system_root is not a business entity");
        };
    }

    private static String companyFolderName(CompanyEntity company) {
        if (StringUtils.isBlank(company.getCompanyName())) {
            return "Company " + company.getCompanyId();
        }
        return company.getCompanyName().trim();
    }
}
