package com.scaffold.backend.modules.organization.presentation;

import com.scaffold.backend.modules.organization.application.CustomerThemeService;
import com.scaffold.backend.modules.organization.presentation.dto.CustomerThemeResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/themes")
public class CustomerThemeController {

    private final CustomerThemeService customerThemeService;

    public CustomerThemeController(CustomerThemeService customerThemeService) {
        this.customerThemeService = customerThemeService;
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<CustomerThemeResponse> getCustomerTheme(@PathVariable String customerId) {
        return ResponseEntity.ok(customerThemeService.getCustomerTheme(customerId));
    }
}
