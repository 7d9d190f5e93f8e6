package com.example.rentroll.infrastructure.excel;

import com.example.rentroll.domain.model.SectionHeaderClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the spreadsheet heuristics used by the extraction services.
 */
@Configuration
public class RentRollConfiguration {

    /**
     * Rent roll exports mark group headers in the unit column with a bold font.
     *
     * @return classifier treating bold cells as section headers
     */
    @Bean
    public SectionHeaderClassifier sectionHeaderClassifier() {
        return SectionHeaderClassifier.boldCells();
    }
}
