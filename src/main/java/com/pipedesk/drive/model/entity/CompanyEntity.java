package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("crm_company")
public class CompanyEntity {

    @TableId(type = IdType.INPUT)
    private String companyId;

    private String companyName;

    private LocalDateTime deletedAt;
}
