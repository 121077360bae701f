package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("crm_lead")
public class LeadEntity {

    @TableId(type = IdType.INPUT)
    private String leadId;

    private String legalName;

    private String companyId;

    private LocalDateTime deletedAt;
}
