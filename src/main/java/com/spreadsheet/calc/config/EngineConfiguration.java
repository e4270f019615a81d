package com.spreadsheet.calc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.parser.FormulaParser;
import com.spreadsheet.calc.services.FormulaEngine;
import com.spreadsheet.calc.validation.FormulaValidator;
import com.spreadsheet.calc.validation.GoldenCaseReader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine, which itself carries no Spring annotations, into the
 * application context.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public FormulaParser formulaParser(CalculationProperties properties) {
        return new FormulaParser(properties.getMaxNestingDepth(), properties.getFormulaCacheSize());
    }

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.standard();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService calculationWorkers(CalculationProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "calc-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getParallelism()), factory);
    }

    @Bean
    public FormulaEngine formulaEngine(FormulaParser parser, FunctionRegistry functions,
                                       ExecutorService calculationWorkers, CalculationProperties properties) {
        return new FormulaEngine(parser, functions, calculationWorkers,
                properties.getParallelism(), properties.getParallelThreshold());
    }

    @Bean
    public FormulaValidator formulaValidator(FormulaEngine engine, CalculationProperties calculation,
                                             ValidationProperties validation) {
        return new FormulaValidator(engine, calculation.toSettings(), validation.getNumericTolerance(),
                validation.getCategoryTolerances());
    }

    @Bean
    public GoldenCaseReader goldenCaseReader(ObjectMapper objectMapper) {
        return new GoldenCaseReader(objectMapper);
    }
}
