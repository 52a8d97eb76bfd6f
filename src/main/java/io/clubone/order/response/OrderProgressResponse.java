package io.clubone.order.response;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderProgressResponse {
	private String status;
	private boolean rejected;
	// -1 when the status sits outside the stage sequence
	private int currentStageIndex;
	private int rejectionStageIndex;
	private List<ProgressStageDTO> stages;
}
