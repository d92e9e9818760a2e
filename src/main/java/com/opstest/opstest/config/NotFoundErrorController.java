package com.opstest.opstest.config;

import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.web.ServerProperties;
import org.springframework.boot.autoconfigure.web.servlet.error.BasicErrorController;
import org.springframework.boot.autoconfigure.web.servlet.error.ErrorViewResolver;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;

// The error path is only meaningful as a forward target; called directly it is just another unknown route.
@Controller
public class NotFoundErrorController extends BasicErrorController {

  public NotFoundErrorController(ErrorAttributes errorAttributes, ServerProperties serverProperties,
      ObjectProvider<ErrorViewResolver> errorViewResolvers) {
    super(errorAttributes, serverProperties.getError(),
        errorViewResolvers.orderedStream().collect(Collectors.toList()));
  }

  @Override
  protected HttpStatus getStatus(HttpServletRequest request) {
    if (request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE) == null) {
      return HttpStatus.NOT_FOUND;
    }
    return super.getStatus(request);
  }
}
