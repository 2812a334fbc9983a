package com.PayRecon.recon_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.modelmapper.convention.MatchingStrategies;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ReconciliationConfig {

    @Bean
    public ModelMapper modelMapper() {
        ModelMapper modelMapper = new ModelMapper();
        modelMapper.getConfiguration()
                .setMatchingStrategy(MatchingStrategies.STRICT)
                .setSkipNullEnabled(true);
        return modelMapper;
    }

    @Bean
    public OnCostRates onCostRates(ReconciliationProperties properties) {
        OnCostRates rates = OnCostRates.from(properties.getAccrual());
        log.info("On-cost rates: super={}, annual leave={}, payroll tax={}, workcover={}, fortnight days={}",
                rates.getSuperannuationRate(), rates.getAnnualLeaveRate(), rates.getPayrollTaxRate(),
                rates.getWorkcoverRate(), rates.getFortnightDays());
        return rates;
    }
}
