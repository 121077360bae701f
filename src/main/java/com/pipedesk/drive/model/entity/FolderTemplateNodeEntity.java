package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("folder_template_node")
public class FolderTemplateNodeEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long nodeId;

    private Long templateId;

    // null means direct child of the entity folder
    private Long parentNodeId;

    private String nodeName;

    @TableField(fill = FieldFill.INSERT)
    private Integer sortOrder;
}
