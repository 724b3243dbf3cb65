package com.fraud.analytics.api;

import com.fraud.analytics.training.LabeledRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {

    @NotEmpty(message = "records must not be empty")
    private List<LabeledRecord> records;

    @Valid
    private TrainingParametersDto options;
}
