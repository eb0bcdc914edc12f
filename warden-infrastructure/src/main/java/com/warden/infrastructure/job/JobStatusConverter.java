package com.warden.infrastructure.job;

import com.warden.domain.job.JobStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class JobStatusConverter implements AttributeConverter<JobStatus, String> {

  @Override
  public String convertToDatabaseColumn(JobStatus attribute) {
    return attribute == null ? null : attribute.wire();
  }

  @Override
  public JobStatus convertToEntityAttribute(String dbData) {
    return dbData == null ? null : JobStatus.fromWire(dbData);
  }
}
