package com.bmsedge.production.service;

import com.bmsedge.production.exception.BusinessException;
import com.bmsedge.production.model.Fabric;
import com.bmsedge.production.repository.FabricRepository;
import com.bmsedge.production.util.FabricNameParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional
public class FabricService {

    private static final Logger logger = LoggerFactory.getLogger(FabricService.class);

    @Autowired
    private FabricRepository fabricRepository;

    @Transactional(readOnly = true)
    public List<Fabric> getAllFabrics() {
        return fabricRepository.findAllByOrderByNameAsc();
    }

    public Fabric createFabric(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException("Fabric name is required");
        }
        if (fabricRepository.existsByName(name)) {
            throw new BusinessException("Fabric with this name already exists");
        }

        FabricNameParser.ParsedName parsed = FabricNameParser.parse(name);
        Fabric fabric = fabricRepository.save(new Fabric(name, parsed.getCode(), parsed.getShortName()));
        logger.info("Created fabric '{}' as '{}'", name, parsed.getShortName());
        return fabric;
    }
}
