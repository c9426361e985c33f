package my.creativeaudit.app.dto;

import my.creativeaudit.app.service.ReliabilityLevel;

public record CheckReliabilityDto(String checkId,
								  double accuracy,
								  long sampleSize,
								  ReliabilityLevel reliabilityLevel) {
}
