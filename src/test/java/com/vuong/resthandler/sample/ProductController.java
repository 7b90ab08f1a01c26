package com.vuong.resthandler.sample;

import com.vuong.resthandler.core.outcome.RequestOutcomeHandler;
import com.vuong.resthandler.core.projection.Projection;
import com.vuong.resthandler.core.query.QueryOptionsParser;
import com.vuong.resthandler.core.query.QuerySource;
import com.vuong.resthandler.dto.ValidationFailure;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;
    private final RequestOutcomeHandler outcomeHandler;
    private final QueryOptionsParser queryOptionsParser;

    public ProductController(ProductService productService, RequestOutcomeHandler outcomeHandler,
                             QueryOptionsParser queryOptionsParser) {
        this.productService = productService;
        this.outcomeHandler = outcomeHandler;
        this.queryOptionsParser = queryOptionsParser;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam Map<String, String> params) {
        List<ValidationFailure> failures = queryOptionsParser.validate(params);
        if (!failures.isEmpty()) {
            return outcomeHandler.handleValidationFailure(failures);
        }
        return outcomeHandler.handleQuery(productService.query(), queryOptionsParser.parse(params),
                Projection.mapped(ProductView.class));
    }

    @GetMapping("/cached")
    public ResponseEntity<?> listInMemory(@RequestParam Map<String, String> params) {
        return outcomeHandler.handleQuery(QuerySource.of(productService.getAll(), Product.class),
                queryOptionsParser.parse(params),
                Projection.of(ProductView.class, this::toView));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable long id) {
        return outcomeHandler.handleCallback(() -> productService.get(id));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody Product product) {
        return outcomeHandler.handleCallback(() -> productService.add(product));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable long id, @RequestBody Product product) {
        product.setId(id);
        return outcomeHandler.handleCallback(() -> productService.update(product));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable long id) {
        return outcomeHandler.handleCallback(() -> {
            productService.delete(productService.get(id));
            return Map.of("deleted", id);
        });
    }

    @PostMapping("/{id}/discontinue")
    public ResponseEntity<?> discontinue(@PathVariable long id) {
        return outcomeHandler.handleOutcome(productService.discontinue(id));
    }

    private ProductView toView(Product product) {
        ProductView view = new ProductView();
        view.setId(product.getId());
        view.setName(product.getName());
        view.setCategory(product.getCategory());
        view.setPrice(product.getPrice());
        return view;
    }
}
