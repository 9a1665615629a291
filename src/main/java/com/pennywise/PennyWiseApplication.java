package com.pennywise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for PennyWise, a personal finance tracker whose
 * account balances stay consistent with every expense, income and transfer.
 *
 * @EnableTransactionManagement is declared explicitly: every balance mutation
 * depends on @Transactional boundaries.
 */
@SpringBootApplication
@EnableTransactionManagement
public class PennyWiseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PennyWiseApplication.class, args);
    }

}
