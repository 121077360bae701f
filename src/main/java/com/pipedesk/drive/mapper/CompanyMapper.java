package com.pipedesk.drive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pipedesk.drive.model.entity.CompanyEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface CompanyMapper extends BaseMapper<CompanyEntity> {
}
