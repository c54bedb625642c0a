package com.al.shopsync.repository;

import com.al.shopsync.model.EntityMapping;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EntityMappingRepository extends MongoRepository<EntityMapping, String> {
}
