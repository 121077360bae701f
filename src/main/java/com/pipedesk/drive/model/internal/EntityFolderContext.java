package com.pipedesk.drive.model.internal;

import com.pipedesk.drive.enums.EntityTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What the reconciler needs to know about an entity to place its folder.
 */
@Data
@AllArgsConstructor
public class EntityFolderContext {

    private EntityTypeEnum entityType;

    private String entityId;

    // display name of the entity's own folder
    private String folderName;

    // owning company, null for companies and for orphan leads and deals
    private String companyId;
}
