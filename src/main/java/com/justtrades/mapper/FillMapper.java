package com.justtrades.mapper;

import com.justtrades.domain.model.Fill;
import com.justtrades.entity.FillEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface FillMapper {

    FillEntity toEntity(Fill fill);

    Fill toDomain(FillEntity entity);

    List<Fill> toDomainList(List<FillEntity> entities);
}
