package com.example.prism.repository;

import com.example.prism.entity.HoldingEntity;
import com.example.prism.model.AssetType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HoldingRepository extends JpaRepository<HoldingEntity, Long> {

    List<HoldingEntity> findAllByOrderByTypeAscSymbolAsc();

    List<HoldingEntity> findByTypeOrderBySymbolAsc(AssetType type);

    Optional<HoldingEntity> findByTypeAndSymbol(AssetType type, String symbol);

    boolean existsByTypeAndSymbol(AssetType type, String symbol);
}
